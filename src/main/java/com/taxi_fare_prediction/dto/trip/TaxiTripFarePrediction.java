package com.taxi_fare_prediction.dto.trip;

public record TaxiTripFarePrediction(double fareAmount) {}
