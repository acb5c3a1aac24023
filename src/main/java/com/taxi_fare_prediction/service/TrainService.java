package com.taxi_fare_prediction.service;

import com.taxi_fare_prediction.classifier.FixedRoundAdditiveRegression;
import com.taxi_fare_prediction.config.MlContext;
import com.taxi_fare_prediction.dto.train.FarePredictionModel;
import com.taxi_fare_prediction.dto.trip.TaxiTrip;
import com.taxi_fare_prediction.exception.EmptyDatasetException;
import com.taxi_fare_prediction.util.TripInstancesUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import weka.classifiers.meta.FilteredClassifier;
import weka.classifiers.trees.RandomTree;
import weka.core.Instances;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.NominalToBinary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Fits the fare regression pipeline: Label copy, one-hot encoding of VendorId, RateCode and PaymentType,
 * feature concatenation and gradient boosted regression trees.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainService {

    private final TripDatasetService tripDatasetService;

    public FarePredictionModel train(MlContext context, Path trainDataPath) {
        log.info("🧠 Starting training on {}", trainDataPath);
        List<TaxiTrip> trips = tripDatasetService.loadAll(trainDataPath);
        if (trips.isEmpty()) {
            throw new EmptyDatasetException("Training data " + trainDataPath + " has no rows");
        }
        return fit(context, trips);
    }

    public FarePredictionModel fit(MlContext context, List<TaxiTrip> trips) {
        if (trips.isEmpty()) {
            throw new EmptyDatasetException("Cannot fit a fare model without training rows");
        }

        Instances header = TripInstancesUtil.buildHeader(trips, context.getUnseenCategoryPolicy());
        Instances trainData = TripInstancesUtil.toInstances(header, trips, context.getUnseenCategoryPolicy());
        List<String> featureNames = encodedFeatureNames(header);
        log.debug("Feature layout ({} columns): {}", featureNames.size(), featureNames);

        FilteredClassifier pipeline = buildPipeline(context, featureNames.size());
        try {
            pipeline.buildClassifier(trainData);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to fit fare regression pipeline: " + e.getMessage(), e);
        }

        int rounds = ((FixedRoundAdditiveRegression) pipeline.getClassifier()).getNumRoundsPerformed();
        log.info("✅ Fitted {} boosted trees on {} trips with {} features",
                rounds, trainData.numInstances(), featureNames.size());
        return new FarePredictionModel(header, pipeline, context.getUnseenCategoryPolicy(), featureNames, rounds);
    }

    /**
     * @param featureCount width of the encoded feature vector; every tree node weighs all of these columns
     */
    public FilteredClassifier buildPipeline(MlContext context, int featureCount) {
        RandomTree tree = new RandomTree();
        tree.setKValue(featureCount);
        tree.setSeed(context.getSeed());
        tree.setMinNum(context.getMinExamplesPerLeaf());
        // RandomTree reads 0 as unlimited
        tree.setMaxDepth(Math.max(context.getMaxDepth(), 0));
        tree.setNumFolds(0);

        FixedRoundAdditiveRegression boosting = new FixedRoundAdditiveRegression();
        boosting.setClassifier(tree);
        boosting.setNumIterations(context.getNumberOfTrees());
        boosting.setShrinkage(context.getLearningRate());

        FilteredClassifier pipeline = new FilteredClassifier();
        pipeline.setFilter(newOneHotEncoder());
        pipeline.setClassifier(boosting);
        return pipeline;
    }

    /**
     * Names of the columns the trees see, in order, e.g. {@code VendorId=CMT, ..., PassengerCount, TripDistance,
     * PaymentType=CSH, ...}.
     */
    public List<String> encodedFeatureNames(Instances header) {
        Instances encoded;
        try {
            NominalToBinary encoder = newOneHotEncoder();
            encoder.setInputFormat(header);
            encoded = Filter.useFilter(header, encoder);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to derive the encoded feature layout: " + e.getMessage(), e);
        }

        List<String> names = new ArrayList<>();
        for (int i = 0; i < encoded.numAttributes(); i++) {
            if (i != encoded.classIndex()) {
                names.add(encoded.attribute(i).name());
            }
        }
        return names;
    }

    private static NominalToBinary newOneHotEncoder() {
        NominalToBinary encoder = new NominalToBinary();
        // One indicator per value, even for two-valued columns
        encoder.setTransformAllValues(true);
        return encoder;
    }
}
