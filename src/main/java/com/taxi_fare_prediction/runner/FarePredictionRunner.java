package com.taxi_fare_prediction.runner;

import com.taxi_fare_prediction.config.MlContext;
import com.taxi_fare_prediction.service.orchestrator.FarePredictionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fare-prediction.runner.enabled", havingValue = "true", matchIfMissing = true)
public class FarePredictionRunner implements CommandLineRunner {

    private final FarePredictionOrchestrator orchestrator;
    private final MlContext mlContext;

    @Override
    public void run(String... args) {
        log.info("🚀 Starting taxi fare prediction run");
        orchestrator.run(mlContext);
        log.info("🏁 Taxi fare prediction run finished");
    }
}
