package com.taxi_fare_prediction.util;

import com.taxi_fare_prediction.dto.train.RegressionEvaluationResult;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Console output of a run: the metrics block and the completion line.
 */
@Component
public class ConsoleReporter {

    public static final String COMPLETION_MESSAGE = "Prediction completed and files saved.";

    private final PrintStream out;

    public ConsoleReporter() {
        this(System.out);
    }

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    public void printMetrics(RegressionEvaluationResult metrics) {
        out.println();
        out.println("*************************************************");
        out.println("*       Model quality metrics evaluation         ");
        out.println("*------------------------------------------------");
        out.println("*       RSquared Score:      " + format(metrics.getRSquared(), "0.##"));
        out.println("*       Root Mean Squared Error:      " + format(metrics.getRmse(), "#.##"));
        out.flush();
    }

    public void printCompletion() {
        out.println(COMPLETION_MESSAGE);
        out.flush();
    }

    static String format(double value, String pattern) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(value);
    }
}
