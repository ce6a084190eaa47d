package com.autobal.config;

import com.autobal.engine.SpectralFeatureEngine;
import com.autobal.model.DetectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Application-wide Spring configuration.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Detector constants, overridable through {@code autobal.detection.*}.
     */
    @Bean
    public DetectionSettings detectionSettings(
            @Value("${autobal.detection.threshold:0.9}") double threshold,
            @Value("${autobal.detection.min-width-angstroms:2.0}") double minWidthAngstroms,
            @Value("${autobal.detection.reference-line:1549.0}") double referenceLine) {
        DetectionSettings settings = new DetectionSettings(
                threshold, minWidthAngstroms, referenceLine, DetectionSettings.LIGHT_SPEED_KM_S);
        log.info("Detection settings: {}", settings);
        return settings;
    }

    @Bean
    public SpectralFeatureEngine spectralFeatureEngine(DetectionSettings settings) {
        return new SpectralFeatureEngine(settings);
    }

    /**
     * Pool running batch epochs, one task per epoch. Epochs share no mutable state.
     */
    @Bean
    public ThreadPoolTaskExecutor epochExecutor(@Value("${autobal.batch.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("epoch-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    /**
     * Dedicated task scheduler for scheduled methods ({@code @Scheduled}), used by the
     * synthetic epoch generator.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("autobal-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }
}
