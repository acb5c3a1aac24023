package com.taxi_fare_prediction.service;

import com.taxi_fare_prediction.dto.train.FarePredictionModel;
import com.taxi_fare_prediction.dto.train.RegressionEvaluationResult;
import com.taxi_fare_prediction.dto.trip.TaxiTrip;
import com.taxi_fare_prediction.dto.trip.TaxiTripFarePrediction;
import com.taxi_fare_prediction.exception.EmptyDatasetException;
import com.taxi_fare_prediction.exception.FileProcessingException;
import com.taxi_fare_prediction.util.TripInstancesUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;
import weka.classifiers.Evaluation;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SerializationHelper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ModelService {

    private final TripDatasetService tripDatasetService;

    public RegressionEvaluationResult evaluate(FarePredictionModel model, Path testDataPath) {
        log.info("📊 Evaluating model on {}", testDataPath);
        List<TaxiTrip> trips = tripDatasetService.loadAll(testDataPath);
        if (trips.isEmpty()) {
            throw new EmptyDatasetException("Test data " + testDataPath + " has no rows");
        }
        return evaluateRegressor(model, trips);
    }

    public RegressionEvaluationResult evaluateRegressor(FarePredictionModel model, List<TaxiTrip> trips) {
        if (trips.isEmpty()) {
            throw new EmptyDatasetException("Cannot evaluate a fare model without test rows");
        }
        Instances test = TripInstancesUtil.toInstances(model.getHeader(), trips, model.getUnseenCategoryPolicy());

        Evaluation eval;
        double[] scores;
        try {
            eval = new Evaluation(test);
            scores = eval.evaluateModel(model.getPipeline(), test);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to evaluate fare model: " + e.getMessage(), e);
        }

        List<Double> actual = new ArrayList<>(test.numInstances());
        List<Double> predicted = new ArrayList<>(test.numInstances());
        for (int i = 0; i < test.numInstances(); i++) {
            actual.add(test.instance(i).classValue());
            predicted.add(scores[i]);
        }

        RegressionEvaluationResult result = new RegressionEvaluationResult(
                eval.rootMeanSquaredError(),
                eval.meanAbsoluteError(),
                rSquared(actual, predicted),
                eval.toSummaryString(),
                actual,
                predicted
        );
        log.info("✅ Evaluated {} trips: R2={}, RMSE={}, MAE={}",
                trips.size(), result.getRSquared(), result.getRmse(), result.getMae());
        log.debug("Evaluation summary:{}", result.getSummary());
        return result;
    }

    /**
     * Coefficient of determination, 1 - SS_res / SS_tot. NaN when all actual values are equal.
     */
    public static double rSquared(List<Double> actual, List<Double> predicted) {
        if (actual.size() != predicted.size()) {
            throw new IllegalArgumentException("Got " + actual.size() + " labels but " + predicted.size() + " scores");
        }
        double mean = actual.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
        double residual = 0;
        double total = 0;
        for (int i = 0; i < actual.size(); i++) {
            double error = actual.get(i) - predicted.get(i);
            double spread = actual.get(i) - mean;
            residual += error * error;
            total += spread * spread;
        }
        if (total == 0) {
            return Double.NaN;
        }
        return 1 - residual / total;
    }

    public TaxiTripFarePrediction predict(FarePredictionModel model, TaxiTrip trip) {
        Instance instance = TripInstancesUtil.toInstance(model.getHeader(), trip, model.getUnseenCategoryPolicy(), false);
        try {
            return new TaxiTripFarePrediction(model.getPipeline().classifyInstance(instance));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to predict fare for " + trip + ": " + e.getMessage(), e);
        }
    }

    public void saveModel(FarePredictionModel model, Path modelPath) {
        try {
            FileUtils.forceMkdirParent(modelPath.toFile());
            try (OutputStream out = Files.newOutputStream(modelPath)) {
                SerializationHelper.write(out, model);
            }
        } catch (Exception e) {
            throw new FileProcessingException("Failed to save model to " + modelPath, e);
        }
        log.info("💾 Saved model to {}", modelPath);
    }

    public FarePredictionModel loadModel(Path modelPath) {
        if (!Files.isRegularFile(modelPath)) {
            throw new FileProcessingException("Model file not found: " + modelPath);
        }

        Object loaded;
        try (InputStream in = Files.newInputStream(modelPath)) {
            loaded = SerializationHelper.read(in);
        } catch (IOException e) {
            throw new FileProcessingException("Failed to read model from " + modelPath, e);
        } catch (Exception e) {
            throw new FileProcessingException("Failed to deserialize model from " + modelPath + ": " + e.getMessage(), e);
        }

        if (!(loaded instanceof FarePredictionModel model)) {
            String found = loaded == null ? "null" : loaded.getClass().getName();
            throw new FileProcessingException("File " + modelPath + " holds " + found + ", not a fare prediction model");
        }
        log.info("📦 Loaded model from {} ({} features)", modelPath, model.getFeatureCount());
        return model;
    }
}
