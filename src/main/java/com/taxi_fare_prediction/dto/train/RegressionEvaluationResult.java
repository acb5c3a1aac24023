package com.taxi_fare_prediction.dto.train;

import lombok.Data;

import java.util.List;

@Data
public class RegressionEvaluationResult {
    private final double rmse;
    private final double mae;
    private final double rSquared;
    private final String summary;

    private final List<Double> actualValues;
    private final List<Double> predictedValues;
}
