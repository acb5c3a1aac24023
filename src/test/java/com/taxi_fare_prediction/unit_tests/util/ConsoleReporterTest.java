package com.taxi_fare_prediction.unit_tests.util;

import com.taxi_fare_prediction.dto.train.RegressionEvaluationResult;
import com.taxi_fare_prediction.util.ConsoleReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    private ByteArrayOutputStream buffer;
    private ConsoleReporter reporter;

    @BeforeEach
    void setup() {
        buffer = new ByteArrayOutputStream();
        reporter = new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void printMetrics_RoundsToTwoDecimals() {
        reporter.printMetrics(result(0.9185, 2.375));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Model quality metrics evaluation"));
        assertTrue(output.contains("RSquared Score:      0.92"));
        assertTrue(output.contains("Root Mean Squared Error:      2.38"));
    }

    @Test
    void printMetrics_DropsTrailingZeros() {
        reporter.printMetrics(result(0.5, 3.0));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("RSquared Score:      0.5" + System.lineSeparator()));
        assertTrue(output.contains("Root Mean Squared Error:      3" + System.lineSeparator()));
    }

    @Test
    void printMetrics_UndefinedRSquared_PrintsNaN() {
        reporter.printMetrics(result(Double.NaN, 0.0));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("RSquared Score:      NaN"));
    }

    @Test
    void printMetrics_NegativeRSquared_KeepsSign() {
        reporter.printMetrics(result(-1.254, 4.0));

        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("RSquared Score:      -1.25"));
    }

    @Test
    void printCompletion_PrintsFixedMessage() {
        reporter.printCompletion();

        assertEquals(ConsoleReporter.COMPLETION_MESSAGE + System.lineSeparator(),
                buffer.toString(StandardCharsets.UTF_8));
    }

    private static RegressionEvaluationResult result(double rSquared, double rmse) {
        return new RegressionEvaluationResult(rmse, rmse, rSquared, "", List.of(), List.of());
    }
}
