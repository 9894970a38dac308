package com.optionsbacktest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Backtest Module Configuration
 *
 * Controls the backtest service: the master switch, the annualization basis used by
 * the metrics, cache sizes and the sweep thread pool.
 *
 * Thread-safety: immutable after Spring initialization (all fields are set via
 * property binding). Safe for concurrent access.
 */
@Configuration
@ConfigurationProperties(prefix = "backtest")
@Data
public class BacktestProperties {

    /**
     * Master switch. When disabled every run request is rejected.
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Trading days per year for annualized return, Sharpe and Sortino.
     * Default: 252
     */
    private int tradingDaysPerYear = 252;

    /**
     * Snapshots kept by the per-run LRU in front of the market data provider.
     * 0 disables the cache.
     * Default: 64
     */
    private int snapshotCacheSize = 64;

    /**
     * Completed results kept in memory; the oldest is evicted first.
     * Default: 50
     */
    private int resultCacheSize = 50;

    // ==================== SWEEP POOL ====================

    private int sweepCorePoolSize = 2;

    private int sweepMaxPoolSize = 4;

    private int sweepQueueCapacity = 100;
}
