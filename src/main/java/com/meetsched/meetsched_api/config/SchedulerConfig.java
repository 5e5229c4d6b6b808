package com.meetsched.meetsched_api.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.meetsched.meetsched_api.solver.RandomSourceFactory;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock schedulerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSourceFactory randomSourceFactory(SchedulerProperties properties) {
        Long seed = properties.getAnnealing().getSeed();
        if (seed != null) {
            logger.info("Annealing runs use fixed seed {}", seed);
            return RandomSourceFactory.seeded(seed);
        }
        return RandomSourceFactory.unseeded();
    }
}
