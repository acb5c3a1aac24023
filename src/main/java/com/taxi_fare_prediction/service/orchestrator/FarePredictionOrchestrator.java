package com.taxi_fare_prediction.service.orchestrator;

import com.taxi_fare_prediction.config.MlContext;
import com.taxi_fare_prediction.config.PathResolver;
import com.taxi_fare_prediction.dto.train.FarePredictionModel;
import com.taxi_fare_prediction.dto.train.PredictionRunSummary;
import com.taxi_fare_prediction.dto.train.RegressionEvaluationResult;
import com.taxi_fare_prediction.enumeration.DataFileTypeEnum;
import com.taxi_fare_prediction.service.ModelService;
import com.taxi_fare_prediction.service.PredictionService;
import com.taxi_fare_prediction.service.TrainService;
import com.taxi_fare_prediction.util.ConsoleReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the steps strictly in sequence: train, evaluate, predict the training file, predict the test file.
 * Nothing is caught here; the first failure aborts the remaining steps.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FarePredictionOrchestrator {

    private final PathResolver pathResolver;
    private final TrainService trainService;
    private final ModelService modelService;
    private final PredictionService predictionService;
    private final ConsoleReporter consoleReporter;

    @Value("${fare-prediction.model.save:false}")
    private boolean saveModel;

    @Value("${fare-prediction.model.reuse:false}")
    private boolean reuseModel;

    public PredictionRunSummary run(MlContext context) {
        Path trainDataPath = pathResolver.resolve(DataFileTypeEnum.TRAIN_DATASET);
        Path testDataPath = pathResolver.resolve(DataFileTypeEnum.TEST_DATASET);
        Path modelPath = pathResolver.resolve(DataFileTypeEnum.MODEL);
        Path trainOutputPath = pathResolver.resolve(DataFileTypeEnum.TRAIN_PREDICTIONS);
        Path testOutputPath = pathResolver.resolve(DataFileTypeEnum.TEST_PREDICTIONS);

        FarePredictionModel model = obtainModel(context, trainDataPath, modelPath);

        RegressionEvaluationResult metrics = modelService.evaluate(model, testDataPath);
        consoleReporter.printMetrics(metrics);

        int trainCount = predictionService.predictFareAndWriteToFile(model, trainDataPath, trainOutputPath);
        int testCount = predictionService.predictFareAndWriteToFile(model, testDataPath, testOutputPath);

        consoleReporter.printCompletion();
        return new PredictionRunSummary(metrics, trainOutputPath, trainCount, testOutputPath, testCount);
    }

    private FarePredictionModel obtainModel(MlContext context, Path trainDataPath, Path modelPath) {
        if (reuseModel && Files.isRegularFile(modelPath)) {
            log.info("♻️ Reusing trained model {}", modelPath);
            return modelService.loadModel(modelPath);
        }

        FarePredictionModel model = trainService.train(context, trainDataPath);
        if (saveModel) {
            modelService.saveModel(model, modelPath);
        }
        return model;
    }
}
