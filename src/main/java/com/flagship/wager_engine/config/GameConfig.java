package com.flagship.wager_engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Infrastructure shared by the round drivers and the scheduled jobs.
 */
@Configuration
public class GameConfig {

    /**
     * Source of round outcomes. Not a provably-fair commitment scheme.
     */
    @Bean
    public Random outcomeRandom() {
        return new SecureRandom();
    }

    /**
     * Runs round timers as well as the {@code @Scheduled} jobs.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${game.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("round-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
