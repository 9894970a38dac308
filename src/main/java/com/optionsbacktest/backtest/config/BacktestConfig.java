package com.optionsbacktest.backtest.config;

import com.optionsbacktest.config.BacktestProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Configuration for parallel backtest sweeps.
 *
 * Provides a dedicated thread pool so that:
 * - independent runs of a parameter sweep execute concurrently
 * - parallelism stays bounded by the configured pool sizes
 */
@Configuration
@EnableAsync
@Slf4j
public class BacktestConfig {

    /**
     * Executor for sweep runs. Each task owns its engine and context, so no state is shared
     * between threads.
     */
    @Bean(name = "backtestExecutor")
    public Executor backtestExecutor(BacktestProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getSweepCorePoolSize());
        executor.setMaxPoolSize(properties.getSweepMaxPoolSize());
        executor.setQueueCapacity(properties.getSweepQueueCapacity());
        executor.setThreadNamePrefix("Backtest-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Backtest task rejected, queue full. Consider reducing sweep size.");
            throw new RejectedExecutionException(
                    "Backtest queue full. Please wait for current backtests to complete.");
        });
        executor.initialize();
        log.info("Backtest executor initialized: corePool={}, maxPool={}, queue={}",
                properties.getSweepCorePoolSize(), properties.getSweepMaxPoolSize(),
                properties.getSweepQueueCapacity());
        return executor;
    }
}
