package com.taxi_fare_prediction.config;

import com.taxi_fare_prediction.enumeration.UnseenCategoryPolicyEnum;
import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by every step of a run. Built once from configuration and handed to each service call
 * by the orchestrator.
 */
@Value
@Builder(toBuilder = true)
public class MlContext {

    @Builder.Default
    int seed = 0;

    @Builder.Default
    int numberOfTrees = 100;

    @Builder.Default
    double learningRate = 0.2;

    @Builder.Default
    double minExamplesPerLeaf = 10;

    /** -1 leaves the depth unlimited. */
    @Builder.Default
    int maxDepth = -1;

    @Builder.Default
    UnseenCategoryPolicyEnum unseenCategoryPolicy = UnseenCategoryPolicyEnum.UNKNOWN_BUCKET;
}
