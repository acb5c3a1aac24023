package com.taxi_fare_prediction.dto.train;

import com.taxi_fare_prediction.enumeration.UnseenCategoryPolicyEnum;
import lombok.Getter;
import weka.classifiers.Classifier;
import weka.core.Instances;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * The fitted pipeline: the empty dataset header that fixes the categorical vocabularies and column order,
 * the one-hot encoder chained with the boosted trees, and the encoded feature layout.
 * Never modified after training, so it can be shared by evaluation and every prediction pass.
 */
@Getter
public class FarePredictionModel implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Instances header;
    private final Classifier pipeline;
    private final UnseenCategoryPolicyEnum unseenCategoryPolicy;
    private final List<String> featureNames;
    private final int boostingRounds;

    public FarePredictionModel(Instances header, Classifier pipeline, UnseenCategoryPolicyEnum unseenCategoryPolicy,
                               List<String> featureNames, int boostingRounds) {
        this.header = new Instances(header, 0);
        this.pipeline = pipeline;
        this.unseenCategoryPolicy = unseenCategoryPolicy;
        this.featureNames = List.copyOf(featureNames);
        this.boostingRounds = boostingRounds;
    }

    public int getFeatureCount() {
        return featureNames.size();
    }
}
