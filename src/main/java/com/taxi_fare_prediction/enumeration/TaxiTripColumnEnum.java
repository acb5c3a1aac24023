package com.taxi_fare_prediction.enumeration;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Columns of the trip CSV files in file order. The first seven make up the input files,
 * the predicted fare is appended as the eighth column of the output files.
 */
public enum TaxiTripColumnEnum {
    VENDOR_ID("VendorId"),
    RATE_CODE("RateCode"),
    PASSENGER_COUNT("PassengerCount"),
    TRIP_TIME("TripTime"),
    TRIP_DISTANCE("TripDistance"),
    PAYMENT_TYPE("PaymentType"),
    FARE_AMOUNT("FareAmount"),
    PREDICTED_FARE_AMOUNT("PredictedFareAmount");

    public static final int INPUT_COLUMN_COUNT = 7;

    private final String header;

    TaxiTripColumnEnum(String header) {
        this.header = header;
    }

    public String getHeader() {
        return header;
    }

    public static List<TaxiTripColumnEnum> inputColumns() {
        return Arrays.asList(values()).subList(0, INPUT_COLUMN_COUNT);
    }

    public static List<TaxiTripColumnEnum> outputColumns() {
        return Arrays.asList(values());
    }

    public static String inputHeaderLine() {
        return inputColumns().stream().map(TaxiTripColumnEnum::getHeader).collect(Collectors.joining(","));
    }

    public static String outputHeaderLine() {
        return outputColumns().stream().map(TaxiTripColumnEnum::getHeader).collect(Collectors.joining(","));
    }
}
