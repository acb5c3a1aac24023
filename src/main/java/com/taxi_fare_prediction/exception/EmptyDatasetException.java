package com.taxi_fare_prediction.exception;

public class EmptyDatasetException extends RuntimeException {

    public EmptyDatasetException(String message) {
        super(message);
    }
}
