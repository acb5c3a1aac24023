package com.taxi_fare_prediction.enumeration;

public enum DataFileTypeEnum {
    TRAIN_DATASET,
    TEST_DATASET,
    MODEL,
    TRAIN_PREDICTIONS,
    TEST_PREDICTIONS
}
