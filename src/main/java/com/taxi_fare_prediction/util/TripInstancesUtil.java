package com.taxi_fare_prediction.util;

import com.taxi_fare_prediction.dto.trip.TaxiTrip;
import com.taxi_fare_prediction.enumeration.TaxiTripColumnEnum;
import com.taxi_fare_prediction.enumeration.UnseenCategoryPolicyEnum;
import com.taxi_fare_prediction.exception.UnseenCategoryException;
import lombok.extern.slf4j.Slf4j;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps trips onto Weka datasets. The header keeps only the model inputs, in the order the encoded
 * feature vector must have: VendorId, RateCode, PassengerCount, TripDistance, PaymentType, then the
 * Label (a copy of FareAmount) as class attribute. TripTime is never part of it.
 */
@Slf4j
public class TripInstancesUtil {

    public static final String RELATION_NAME = "taxi-fare";
    public static final String LABEL = "Label";
    public static final String UNKNOWN_CATEGORY = "__unknown__";

    private static final int VENDOR_ID = 0;
    private static final int RATE_CODE = 1;
    private static final int PASSENGER_COUNT = 2;
    private static final int TRIP_DISTANCE = 3;
    private static final int PAYMENT_TYPE = 4;
    private static final int LABEL_INDEX = 5;

    private TripInstancesUtil() {
    }

    /**
     * Builds the empty dataset header. Categorical vocabularies are the tokens of {@code trips} in order of
     * first appearance, plus the reserved unknown bucket under {@link UnseenCategoryPolicyEnum#UNKNOWN_BUCKET}.
     */
    public static Instances buildHeader(List<TaxiTrip> trips, UnseenCategoryPolicyEnum policy) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute(TaxiTripColumnEnum.VENDOR_ID.getHeader(),
                vocabulary(trips, TaxiTrip::getVendorId, policy)));
        attributes.add(new Attribute(TaxiTripColumnEnum.RATE_CODE.getHeader(),
                vocabulary(trips, TaxiTrip::getRateCode, policy)));
        attributes.add(new Attribute(TaxiTripColumnEnum.PASSENGER_COUNT.getHeader()));
        attributes.add(new Attribute(TaxiTripColumnEnum.TRIP_DISTANCE.getHeader()));
        attributes.add(new Attribute(TaxiTripColumnEnum.PAYMENT_TYPE.getHeader(),
                vocabulary(trips, TaxiTrip::getPaymentType, policy)));
        attributes.add(new Attribute(LABEL));

        Instances header = new Instances(RELATION_NAME, attributes, 0);
        header.setClassIndex(LABEL_INDEX);
        return header;
    }

    public static Instances toInstances(Instances header, List<TaxiTrip> trips, UnseenCategoryPolicyEnum policy) {
        Instances data = new Instances(header, trips.size());
        for (TaxiTrip trip : trips) {
            data.add(toInstance(data, trip, policy, true));
        }
        return data;
    }

    /**
     * @param withLabel copy FareAmount into the Label attribute; when false the label is left missing,
     *                  which is how rows are presented to the model for prediction
     */
    public static Instance toInstance(Instances header, TaxiTrip trip, UnseenCategoryPolicyEnum policy,
                                      boolean withLabel) {
        double[] values = new double[header.numAttributes()];
        values[VENDOR_ID] = categoryIndex(header.attribute(VENDOR_ID), trip.getVendorId(), policy);
        values[RATE_CODE] = categoryIndex(header.attribute(RATE_CODE), trip.getRateCode(), policy);
        values[PASSENGER_COUNT] = trip.getPassengerCount();
        values[TRIP_DISTANCE] = trip.getTripDistance();
        values[PAYMENT_TYPE] = categoryIndex(header.attribute(PAYMENT_TYPE), trip.getPaymentType(), policy);
        values[LABEL_INDEX] = withLabel ? trip.getFareAmount() : Utils.missingValue();

        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }

    private static List<String> vocabulary(List<TaxiTrip> trips, Function<TaxiTrip, String> column,
                                           UnseenCategoryPolicyEnum policy) {
        Set<String> tokens = new LinkedHashSet<>();
        for (TaxiTrip trip : trips) {
            tokens.add(column.apply(trip));
        }
        if (policy == UnseenCategoryPolicyEnum.UNKNOWN_BUCKET) {
            tokens.add(UNKNOWN_CATEGORY);
        }
        return new ArrayList<>(tokens);
    }

    private static int categoryIndex(Attribute attribute, String token, UnseenCategoryPolicyEnum policy) {
        int index = attribute.indexOfValue(token);
        if (index >= 0) {
            return index;
        }
        if (policy == UnseenCategoryPolicyEnum.ERROR) {
            throw new UnseenCategoryException(attribute.name(), token);
        }
        int unknown = attribute.indexOfValue(UNKNOWN_CATEGORY);
        if (unknown < 0) {
            throw new IllegalStateException("Attribute " + attribute.name() + " has no unknown bucket");
        }
        log.warn("⚠️ Category '{}' of {} not seen in training, using the unknown bucket", token, attribute.name());
        return unknown;
    }
}
