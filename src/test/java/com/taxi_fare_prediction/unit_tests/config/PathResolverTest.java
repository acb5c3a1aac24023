package com.taxi_fare_prediction.unit_tests.config;

import com.taxi_fare_prediction.config.PathResolver;
import com.taxi_fare_prediction.enumeration.DataFileTypeEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class PathResolverTest {

    private PathResolver pathResolver;

    @BeforeEach
    void setUp() {
        pathResolver = new PathResolver();
        ReflectionTestUtils.setField(pathResolver, "dataDir", "Data");
        ReflectionTestUtils.setField(pathResolver, "trainFile", "taxi-fare-train.csv");
        ReflectionTestUtils.setField(pathResolver, "testFile", "taxi-fare-test.csv");
        ReflectionTestUtils.setField(pathResolver, "modelFile", "Model.zip");
        ReflectionTestUtils.setField(pathResolver, "outputDir", "");
        ReflectionTestUtils.setField(pathResolver, "trainOutputFile", "train_predicted.csv");
        ReflectionTestUtils.setField(pathResolver, "testOutputFile", "test_predicted.csv");
    }

    @Test
    void resolve_Defaults_InputsUnderDataDirOutputsInWorkingDir() {
        Path workingDir = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();

        assertEquals(workingDir.resolve("Data").resolve("taxi-fare-train.csv"),
                pathResolver.resolve(DataFileTypeEnum.TRAIN_DATASET));
        assertEquals(workingDir.resolve("Data").resolve("taxi-fare-test.csv"),
                pathResolver.resolve(DataFileTypeEnum.TEST_DATASET));
        assertEquals(workingDir.resolve("Data").resolve("Model.zip"), pathResolver.resolve(DataFileTypeEnum.MODEL));
        assertEquals(workingDir.resolve("train_predicted.csv"), pathResolver.resolve(DataFileTypeEnum.TRAIN_PREDICTIONS));
        assertEquals(workingDir.resolve("test_predicted.csv"), pathResolver.resolve(DataFileTypeEnum.TEST_PREDICTIONS));
    }

    @Test
    void resolve_AbsoluteDirectories_UsedAsIs(@TempDir Path tempDir) {
        ReflectionTestUtils.setField(pathResolver, "dataDir", tempDir.resolve("in").toString());
        ReflectionTestUtils.setField(pathResolver, "outputDir", tempDir.resolve("out").toString());

        assertEquals(tempDir.resolve("in").resolve("taxi-fare-test.csv"),
                pathResolver.resolve(DataFileTypeEnum.TEST_DATASET));
        assertEquals(tempDir.resolve("out").resolve("train_predicted.csv"),
                pathResolver.resolve(DataFileTypeEnum.TRAIN_PREDICTIONS));
    }

    @Test
    void getDataRoot_BlankSetting_FallsBackToData() {
        ReflectionTestUtils.setField(pathResolver, "dataDir", " ");

        assertEquals(Path.of("Data"), pathResolver.getDataRoot().getFileName());
    }
}
