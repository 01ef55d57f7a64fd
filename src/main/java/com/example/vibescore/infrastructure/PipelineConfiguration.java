package com.example.vibescore.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

@Configuration
public class PipelineConfiguration {

    /**
     * Randomness for windowing, commit sampling and question order. A non-zero seed makes runs
     * reproducible.
     */
    @Bean
    public Random pipelineRandom(@Value("${vibescore.random.seed:0}") long seed) {
        return seed != 0 ? new Random(seed) : new Random();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
