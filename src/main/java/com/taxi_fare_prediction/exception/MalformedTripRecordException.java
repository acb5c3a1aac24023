package com.taxi_fare_prediction.exception;

import java.nio.file.Path;

/**
 * A data row of a trip file that does not fit the 7-column schema.
 */
public class MalformedTripRecordException extends RuntimeException {

    private final Path file;
    private final long lineNumber;

    public MalformedTripRecordException(Path file, long lineNumber, String reason) {
        super("Malformed row at " + file + ":" + lineNumber + " - " + reason);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public MalformedTripRecordException(Path file, long lineNumber, String reason, Throwable cause) {
        super("Malformed row at " + file + ":" + lineNumber + " - " + reason, cause);
        this.file = file;
        this.lineNumber = lineNumber;
    }

    public Path getFile() {
        return file;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
