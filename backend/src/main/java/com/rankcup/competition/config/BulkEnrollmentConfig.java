package com.rankcup.competition.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class BulkEnrollmentConfig {

    public static final String BULK_ENROLLMENT_EXECUTOR = "bulkEnrollmentExecutor";

    @Bean(name = BULK_ENROLLMENT_EXECUTOR)
    public ThreadPoolTaskExecutor bulkEnrollmentExecutor(CompetitionProperties competitionProperties) {
        int parallelism = Math.max(1, competitionProperties.getBulkEnrollment().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(Math.max(1, competitionProperties.getBulkEnrollment().getQueueCapacity()));
        executor.setThreadNamePrefix("bulk-enroll-");
        // A full queue makes the submitting request do the work itself instead of dropping players.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
