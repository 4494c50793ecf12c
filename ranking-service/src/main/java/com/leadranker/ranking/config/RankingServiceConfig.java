package com.leadranker.ranking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.leadranker.common.model.OptimizationProgress;
import com.leadranker.common.model.RankingProgress;
import com.leadranker.ranking.progress.ProgressStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class RankingServiceConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public ProgressStore<RankingProgress> rankingProgressStore() {
        return new ProgressStore<>(RankingProgress::idle);
    }

    @Bean
    public ProgressStore<OptimizationProgress> optimizationProgressStore() {
        return new ProgressStore<>(OptimizationProgress::idle);
    }

    /** Source of randomness for sampling, tournament selection and operator choice. */
    @Bean
    public Random optimizerRandom() {
        return new Random();
    }
}
