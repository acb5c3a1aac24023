package com.taxi_fare_prediction.unit_tests.util;

import com.taxi_fare_prediction.dto.trip.TaxiTrip;
import com.taxi_fare_prediction.exception.MalformedTripRecordException;
import com.taxi_fare_prediction.util.TripCsvUtil;
import com.taxi_fare_prediction.util.TripFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TripCsvUtilTest {

    private static final Path FILE = Path.of("trips.csv");

    @Nested
    @DisplayName("Row parsing")
    class ParseLineTests {

        @Test
        void parseLine_ValidRow_MapsColumnsByPosition() {
            TaxiTrip trip = TripCsvUtil.parseLine(FILE, 2, "VTS,1,2,660,1.3,CRD,7.5");

            assertEquals("VTS", trip.getVendorId());
            assertEquals("1", trip.getRateCode());
            assertEquals(2, trip.getPassengerCount());
            assertEquals(660, trip.getTripTime());
            assertEquals(1.3, trip.getTripDistance());
            assertEquals("CRD", trip.getPaymentType());
            assertEquals(7.5, trip.getFareAmount());
            assertNull(trip.getPredictedFareAmount());
        }

        @Test
        void parseLine_PaddedTokens_AreTrimmed() {
            TaxiTrip trip = TripCsvUtil.parseLine(FILE, 2, " CMT , 2 ,1, 300 , 0.5 ,CSH, 52 ");

            assertEquals("CMT", trip.getVendorId());
            assertEquals("2", trip.getRateCode());
            assertEquals(300, trip.getTripTime());
            assertEquals(52.0, trip.getFareAmount());
        }

        @Test
        void parseLine_TooFewColumns_ReportsLine() {
            MalformedTripRecordException ex = assertThrows(MalformedTripRecordException.class,
                    () -> TripCsvUtil.parseLine(FILE, 5, "VTS,1,1,300,1.0,CSH"));

            assertEquals(5, ex.getLineNumber());
            assertEquals(FILE, ex.getFile());
            assertTrue(ex.getMessage().contains("found 6 columns"));
        }

        @Test
        void parseLine_TrailingEmptyColumn_CountsAsEighthColumn() {
            assertThrows(MalformedTripRecordException.class,
                    () -> TripCsvUtil.parseLine(FILE, 2, "VTS,1,1,300,1.0,CSH,5.0,"));
        }

        @Test
        void parseLine_NonNumericDistance_Rejected() {
            MalformedTripRecordException ex = assertThrows(MalformedTripRecordException.class,
                    () -> TripCsvUtil.parseLine(FILE, 3, "VTS,1,1,300,far,CSH,5.0"));

            assertTrue(ex.getMessage().contains("TripDistance"));
            assertInstanceOf(NumberFormatException.class, ex.getCause());
        }

        @Test
        void parseLine_FractionalPassengerCount_Rejected() {
            assertThrows(MalformedTripRecordException.class,
                    () -> TripCsvUtil.parseLine(FILE, 3, "VTS,1,1.5,300,1.0,CSH,5.0"));
        }

        @Test
        void parseLine_NaNFare_Rejected() {
            assertThrows(MalformedTripRecordException.class,
                    () -> TripCsvUtil.parseLine(FILE, 3, "VTS,1,1,300,1.0,CSH,NaN"));
        }

        @Test
        void parseLine_EmptyCategory_Rejected() {
            MalformedTripRecordException ex = assertThrows(MalformedTripRecordException.class,
                    () -> TripCsvUtil.parseLine(FILE, 4, "VTS,1,1,300,1.0, ,5.0"));

            assertTrue(ex.getMessage().contains("PaymentType"));
        }
    }

    @Nested
    @DisplayName("Header checks")
    class HeaderTests {

        @Test
        void checkHeader_ExpectedHeader_Passes() {
            assertDoesNotThrow(() -> TripCsvUtil.checkHeader(FILE, TripFixtures.HEADER));
        }

        @Test
        void checkHeader_RenamedColumns_OnlyWarns() {
            assertDoesNotThrow(() -> TripCsvUtil.checkHeader(FILE, "vendor_id,rate_code,a,b,c,d,e"));
        }

        @Test
        void checkHeader_WrongColumnCount_RejectedAsLineOne() {
            MalformedTripRecordException ex = assertThrows(MalformedTripRecordException.class,
                    () -> TripCsvUtil.checkHeader(FILE, "VendorId,RateCode,PassengerCount"));

            assertEquals(1, ex.getLineNumber());
        }
    }

    @Nested
    @DisplayName("Output rows")
    class OutputTests {

        @Test
        void toCsvLine_AppendsPredictionAsEighthColumn() {
            TaxiTrip trip = TripCsvUtil.parseLine(FILE, 2, "VTS,1,1,300,1.0,CSH,5.0").withPredictedFareAmount(5.25);

            assertEquals("VTS,1,1,300,1,CSH,5,5.25", TripCsvUtil.toCsvLine(trip));
        }

        @Test
        void toCsvLine_WithoutPrediction_Rejected() {
            TaxiTrip trip = TripCsvUtil.parseLine(FILE, 2, "VTS,1,1,300,1.0,CSH,5.0");

            assertThrows(IllegalArgumentException.class, () -> TripCsvUtil.toCsvLine(trip));
        }

        @Test
        void formatNumber_UsesPlainShortestForm() {
            assertEquals("2.5", TripCsvUtil.formatNumber(2.5));
            assertEquals("10", TripCsvUtil.formatNumber(10.0));
            assertEquals("0.0001", TripCsvUtil.formatNumber(1.0E-4));
            assertEquals("12345678", TripCsvUtil.formatNumber(1.2345678E7));
        }
    }
}
