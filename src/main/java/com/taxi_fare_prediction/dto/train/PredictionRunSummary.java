package com.taxi_fare_prediction.dto.train;

import java.nio.file.Path;

public record PredictionRunSummary(
        RegressionEvaluationResult metrics,
        Path trainPredictionsPath,
        int trainPredictionCount,
        Path testPredictionsPath,
        int testPredictionCount
) {}
