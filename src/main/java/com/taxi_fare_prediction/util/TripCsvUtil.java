package com.taxi_fare_prediction.util;

import com.taxi_fare_prediction.dto.trip.TaxiTrip;
import com.taxi_fare_prediction.enumeration.TaxiTripColumnEnum;
import com.taxi_fare_prediction.exception.MalformedTripRecordException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

@Slf4j
public class TripCsvUtil {

    private static final char SEPARATOR = ',';

    private TripCsvUtil() {
    }

    /**
     * Header names are informational only: columns are always mapped by position. A header with the wrong
     * number of columns means the whole file has the wrong shape.
     */
    public static void checkHeader(Path file, String headerLine) {
        String[] names = StringUtils.splitPreserveAllTokens(headerLine, SEPARATOR);
        if (names.length != TaxiTripColumnEnum.INPUT_COLUMN_COUNT) {
            throw new MalformedTripRecordException(file, 1,
                    "header has " + names.length + " columns, expected " + TaxiTripColumnEnum.INPUT_COLUMN_COUNT);
        }
        List<TaxiTripColumnEnum> columns = TaxiTripColumnEnum.inputColumns();
        for (int i = 0; i < names.length; i++) {
            String expected = columns.get(i).getHeader();
            if (!expected.equalsIgnoreCase(names[i].trim())) {
                log.warn("⚠️ Header column {} of {} is '{}', expected '{}'. Mapping by position.",
                        i + 1, file.getFileName(), names[i].trim(), expected);
            }
        }
    }

    public static TaxiTrip parseLine(Path file, long lineNumber, String line) {
        String[] tokens = StringUtils.splitPreserveAllTokens(line, SEPARATOR);
        if (tokens.length != TaxiTripColumnEnum.INPUT_COLUMN_COUNT) {
            throw new MalformedTripRecordException(file, lineNumber,
                    "found " + tokens.length + " columns, expected " + TaxiTripColumnEnum.INPUT_COLUMN_COUNT);
        }

        return TaxiTrip.builder()
                .vendorId(category(file, lineNumber, tokens, TaxiTripColumnEnum.VENDOR_ID))
                .rateCode(category(file, lineNumber, tokens, TaxiTripColumnEnum.RATE_CODE))
                .passengerCount(integer(file, lineNumber, tokens, TaxiTripColumnEnum.PASSENGER_COUNT))
                .tripTime(integer(file, lineNumber, tokens, TaxiTripColumnEnum.TRIP_TIME))
                .tripDistance(decimal(file, lineNumber, tokens, TaxiTripColumnEnum.TRIP_DISTANCE))
                .paymentType(category(file, lineNumber, tokens, TaxiTripColumnEnum.PAYMENT_TYPE))
                .fareAmount(decimal(file, lineNumber, tokens, TaxiTripColumnEnum.FARE_AMOUNT))
                .build();
    }

    public static String toCsvLine(TaxiTrip trip) {
        if (trip.getPredictedFareAmount() == null) {
            throw new IllegalArgumentException("Trip has no predicted fare to write: " + trip);
        }
        return String.join(String.valueOf(SEPARATOR),
                trip.getVendorId(),
                trip.getRateCode(),
                Integer.toString(trip.getPassengerCount()),
                Integer.toString(trip.getTripTime()),
                formatNumber(trip.getTripDistance()),
                trip.getPaymentType(),
                formatNumber(trip.getFareAmount()),
                formatNumber(trip.getPredictedFareAmount()));
    }

    /**
     * Shortest plain rendering of a double: 2.5, 1, 8.123. Never uses an exponent.
     */
    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String category(Path file, long lineNumber, String[] tokens, TaxiTripColumnEnum column) {
        String token = tokens[column.ordinal()].trim();
        if (token.isEmpty()) {
            throw new MalformedTripRecordException(file, lineNumber, column.getHeader() + " is empty");
        }
        return token;
    }

    private static int integer(Path file, long lineNumber, String[] tokens, TaxiTripColumnEnum column) {
        String token = tokens[column.ordinal()].trim();
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new MalformedTripRecordException(file, lineNumber,
                    column.getHeader() + " '" + token + "' is not an integer", e);
        }
    }

    private static double decimal(Path file, long lineNumber, String[] tokens, TaxiTripColumnEnum column) {
        String token = tokens[column.ordinal()].trim();
        double value;
        try {
            value = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new MalformedTripRecordException(file, lineNumber,
                    column.getHeader() + " '" + token + "' is not a number", e);
        }
        if (!Double.isFinite(value)) {
            throw new MalformedTripRecordException(file, lineNumber,
                    column.getHeader() + " '" + token + "' is not a finite number");
        }
        return value;
    }
}
