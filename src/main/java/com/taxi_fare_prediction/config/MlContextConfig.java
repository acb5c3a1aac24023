package com.taxi_fare_prediction.config;

import com.taxi_fare_prediction.enumeration.UnseenCategoryPolicyEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class MlContextConfig {

    @Value("${fare-prediction.trainer.seed:0}")
    private int seed;

    @Value("${fare-prediction.trainer.number-of-trees:100}")
    private int numberOfTrees;

    @Value("${fare-prediction.trainer.learning-rate:0.2}")
    private double learningRate;

    @Value("${fare-prediction.trainer.min-examples-per-leaf:10}")
    private double minExamplesPerLeaf;

    @Value("${fare-prediction.trainer.max-depth:-1}")
    private int maxDepth;

    @Value("${fare-prediction.encoding.unseen-category-policy:UNKNOWN_BUCKET}")
    private UnseenCategoryPolicyEnum unseenCategoryPolicy;

    @Bean
    public MlContext mlContext() {
        if (numberOfTrees < 1) {
            throw new IllegalArgumentException("fare-prediction.trainer.number-of-trees must be at least 1, got " + numberOfTrees);
        }
        if (learningRate <= 0 || learningRate > 1) {
            throw new IllegalArgumentException("fare-prediction.trainer.learning-rate must be in (0, 1], got " + learningRate);
        }
        MlContext context = MlContext.builder()
                .seed(seed)
                .numberOfTrees(numberOfTrees)
                .learningRate(learningRate)
                .minExamplesPerLeaf(minExamplesPerLeaf)
                .maxDepth(maxDepth)
                .unseenCategoryPolicy(unseenCategoryPolicy)
                .build();
        log.info("⚙️ ML context: {}", context);
        return context;
    }
}
