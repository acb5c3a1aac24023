package com.taxi_fare_prediction.service;

import com.taxi_fare_prediction.dto.trip.TaxiTrip;
import com.taxi_fare_prediction.exception.FileProcessingException;
import com.taxi_fare_prediction.util.TripCsvUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Reads comma separated trip files with a header row.
 */
@Service
@Slf4j
public class TripDatasetService {

    /**
     * Opens {@code path} and returns its rows as a lazy stream. Rows are parsed as the stream is consumed,
     * so a malformed row surfaces at that point. The stream owns the open file: close it when done.
     * Reading again means calling this method again.
     */
    public Stream<TaxiTrip> load(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new FileProcessingException("Trip file not found or not readable: " + path);
        }

        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileProcessingException("Failed to open trip file " + path, e);
        }

        try {
            String header = reader.readLine();
            if (header == null) {
                log.warn("⚠️ Trip file {} is empty, not even a header row", path);
                reader.close();
                return Stream.empty();
            }
            TripCsvUtil.checkHeader(path, header);
        } catch (IOException e) {
            closeAfterFailure(reader, e);
            throw new FileProcessingException("Failed to read header of trip file " + path, e);
        } catch (RuntimeException e) {
            closeAfterFailure(reader, e);
            throw e;
        }

        AtomicLong lineNumber = new AtomicLong(1);
        return reader.lines()
                .map(line -> new NumberedLine(lineNumber.incrementAndGet(), line))
                .filter(line -> StringUtils.isNotBlank(line.text()))
                .map(line -> TripCsvUtil.parseLine(path, line.number(), line.text()))
                .onClose(() -> {
                    try {
                        reader.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to close trip file " + path, e);
                    }
                });
    }

    public List<TaxiTrip> loadAll(Path path) {
        try (Stream<TaxiTrip> trips = load(path)) {
            List<TaxiTrip> loaded = trips.toList();
            log.info("📥 Loaded {} trips from {}", loaded.size(), path);
            return loaded;
        }
    }

    private static void closeAfterFailure(BufferedReader reader, Exception failure) {
        try {
            reader.close();
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private record NumberedLine(long number, String text) {}
}
