package com.taxi_fare_prediction.dto.trip;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One row of a trip file. {@code predictedFareAmount} stays null on rows read from disk and is only
 * filled in on the copies the batch predictor writes out.
 */
@Value
@Builder(toBuilder = true)
public class TaxiTrip {
    String vendorId;
    String rateCode;
    int passengerCount;
    int tripTime;
    double tripDistance;
    String paymentType;
    double fareAmount;

    @With
    Double predictedFareAmount;
}
