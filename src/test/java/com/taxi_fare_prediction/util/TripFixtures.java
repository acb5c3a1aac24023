package com.taxi_fare_prediction.util;

import com.taxi_fare_prediction.config.MlContext;
import com.taxi_fare_prediction.dto.trip.TaxiTrip;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared test data: the sample CSVs on the test classpath and a small, fast training context.
 */
public final class TripFixtures {

    public static final String TRAIN_SAMPLE = "/datasets/taxi-fare-train-sample.csv";
    public static final String TEST_SAMPLE = "/datasets/taxi-fare-test-sample.csv";
    public static final String HEADER = "VendorId,RateCode,PassengerCount,TripTime,TripDistance,PaymentType,FareAmount";

    private TripFixtures() {
    }

    public static Path resource(String name) {
        URL url = TripFixtures.class.getResource(name);
        if (url == null) {
            throw new IllegalStateException("Missing test resource " + name);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Bad test resource location " + url, e);
        }
    }

    public static MlContext fastContext() {
        return MlContext.builder()
                .numberOfTrees(20)
                .minExamplesPerLeaf(5)
                .build();
    }

    public static TaxiTrip trip(String vendorId, String rateCode, double tripDistance, String paymentType,
                                double fareAmount) {
        return TaxiTrip.builder()
                .vendorId(vendorId)
                .rateCode(rateCode)
                .passengerCount(1)
                .tripTime((int) (tripDistance * 200))
                .tripDistance(tripDistance)
                .paymentType(paymentType)
                .fareAmount(fareAmount)
                .build();
    }
}
