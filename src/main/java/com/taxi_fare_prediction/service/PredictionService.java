package com.taxi_fare_prediction.service;

import com.taxi_fare_prediction.dto.train.FarePredictionModel;
import com.taxi_fare_prediction.dto.trip.TaxiTrip;
import com.taxi_fare_prediction.enumeration.TaxiTripColumnEnum;
import com.taxi_fare_prediction.exception.FileProcessingException;
import com.taxi_fare_prediction.util.TripCsvUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scores a trip file one row at a time and writes each row back out with its predicted fare appended.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private final TripDatasetService tripDatasetService;
    private final ModelService modelService;

    /**
     * Reads {@code dataPath} afresh, predicts every row and overwrites {@code outputPath}. All rows are
     * scored before the output file is opened, so a failing row leaves no partial file behind.
     *
     * @return number of rows written
     */
    public int predictFareAndWriteToFile(FarePredictionModel model, Path dataPath, Path outputPath) {
        log.info("🔮 Predicting fares for {}", dataPath);

        List<TaxiTrip> predictedTrips;
        try (Stream<TaxiTrip> trips = tripDatasetService.load(dataPath)) {
            predictedTrips = predictFares(model, trips).toList();
        }

        writeTrips(outputPath, predictedTrips);
        log.info("✅ Wrote {} predicted trips to {}", predictedTrips.size(), outputPath);
        return predictedTrips.size();
    }

    public Stream<TaxiTrip> predictFares(FarePredictionModel model, Stream<TaxiTrip> trips) {
        return trips.map(trip -> trip.withPredictedFareAmount(modelService.predict(model, trip).fareAmount()));
    }

    public void writeTrips(Path outputPath, List<TaxiTrip> predictedTrips) {
        try {
            FileUtils.forceMkdirParent(outputPath.toFile());
            try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
                writer.write(TaxiTripColumnEnum.outputHeaderLine());
                writer.write('\n');
                for (TaxiTrip trip : predictedTrips) {
                    writer.write(TripCsvUtil.toCsvLine(trip));
                    writer.write('\n');
                }
            }
        } catch (IOException e) {
            throw new FileProcessingException("Failed to write predictions to " + outputPath, e);
        }
    }
}
