package com.taxi_fare_prediction.config;

import com.taxi_fare_prediction.enumeration.DataFileTypeEnum;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Inputs and the model artifact live under the data directory; the predicted CSVs go to the output
 * directory, which defaults to the working directory. Relative paths resolve against the working directory.
 */
@Component
public class PathResolver {

    @Value("${fare-prediction.data-dir:Data}")
    private String dataDir;

    @Value("${fare-prediction.train-file:taxi-fare-train.csv}")
    private String trainFile;

    @Value("${fare-prediction.test-file:taxi-fare-test.csv}")
    private String testFile;

    @Value("${fare-prediction.model-file:Model.zip}")
    private String modelFile;

    @Value("${fare-prediction.output-dir:}")
    private String outputDir;

    @Value("${fare-prediction.train-output-file:train_predicted.csv}")
    private String trainOutputFile;

    @Value("${fare-prediction.test-output-file:test_predicted.csv}")
    private String testOutputFile;

    public Path resolve(DataFileTypeEnum type) {
        return switch (type) {
            case TRAIN_DATASET -> getDataRoot().resolve(trainFile);
            case TEST_DATASET -> getDataRoot().resolve(testFile);
            case MODEL -> getDataRoot().resolve(modelFile);
            case TRAIN_PREDICTIONS -> getOutputRoot().resolve(trainOutputFile);
            case TEST_PREDICTIONS -> getOutputRoot().resolve(testOutputFile);
        };
    }

    public Path getDataRoot() {
        return absolute(dataDir != null && !dataDir.isBlank() ? dataDir : "Data");
    }

    public Path getOutputRoot() {
        return absolute(outputDir != null && !outputDir.isBlank() ? outputDir : "");
    }

    private Path absolute(String location) {
        Path configured = Paths.get(location);
        return configured.isAbsolute()
                ? configured
                : Paths.get(System.getProperty("user.dir")).resolve(configured).toAbsolutePath().normalize();
    }
}
