package com.optionsbacktest.backtest.service;

import com.optionsbacktest.backtest.adapter.CachingMarketSnapshotProvider;
import com.optionsbacktest.backtest.adapter.MarketSnapshotProvider;
import com.optionsbacktest.backtest.config.StrategyConfig;
import com.optionsbacktest.backtest.config.StrategyConfigValidator;
import com.optionsbacktest.backtest.dto.BacktestResult;
import com.optionsbacktest.backtest.dto.BacktestResult.BacktestStatus;
import com.optionsbacktest.backtest.engine.BacktestEngine;
import com.optionsbacktest.backtest.engine.BacktestException;
import com.optionsbacktest.config.BacktestProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Orchestrates backtest execution: configuration validation → simulation → result caching.
 * <p>
 * Every run gets its own {@link BacktestEngine} and run context, so sweeps can execute
 * runs in parallel on the {@code backtestExecutor} pool without sharing mutable state.
 * Configuration errors are fatal and thrown before any day is simulated; any other failure
 * is reported as a {@link BacktestStatus#FAILED} result.
 */
@Service
@Slf4j
public class BacktestService {

    private final BacktestProperties properties;
    private final StrategyConfigValidator validator;
    private final Executor backtestExecutor;

    /** In-memory result cache, insertion ordered for eviction. */
    private final Map<String, BacktestResult> resultCache = new LinkedHashMap<>();

    public BacktestService(BacktestProperties properties, StrategyConfigValidator validator,
                           @Qualifier("backtestExecutor") Executor backtestExecutor) {
        this.properties = properties;
        this.validator = validator;
        this.backtestExecutor = backtestExecutor;
    }

    // ==================== SINGLE RUN ====================

    /**
     * Validates the configuration and runs one backtest synchronously.
     *
     * @throws com.optionsbacktest.backtest.config.ConfigValidationException if the configuration is invalid
     * @throws BacktestException if the backtest module is disabled
     */
    public BacktestResult run(StrategyConfig config, MarketSnapshotProvider provider, LocalDate from, LocalDate to) {
        ensureEnabled();
        validator.validate(config);
        return execute(config, provider, from, to);
    }

    // ==================== PARAMETER SWEEP ====================

    /**
     * Runs one backtest per configuration in parallel. Every configuration is validated
     * before any run starts. Results come back in the order of {@code configs}.
     */
    public List<BacktestResult> runSweep(List<StrategyConfig> configs, MarketSnapshotProvider provider,
                                         LocalDate from, LocalDate to) {
        ensureEnabled();
        for (StrategyConfig config : configs) {
            validator.validate(config);
        }

        log.info("Starting sweep of {} configuration(s) over {}..{}", configs.size(), from, to);
        List<CompletableFuture<BacktestResult>> futures = new ArrayList<>(configs.size());
        for (StrategyConfig config : configs) {
            futures.add(CompletableFuture.supplyAsync(() -> execute(config, provider, from, to), backtestExecutor));
        }

        List<BacktestResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<BacktestResult> future : futures) {
            results.add(future.join());
        }
        long failed = results.stream().filter(r -> r.getStatus() == BacktestStatus.FAILED).count();
        log.info("Sweep complete: {} run(s), {} failed", results.size(), failed);
        return results;
    }

    // ==================== RESULT ACCESS ====================

    public BacktestResult getResult(String runId) {
        synchronized (resultCache) {
            return resultCache.get(runId);
        }
    }

    public Collection<BacktestResult> getAllResults() {
        synchronized (resultCache) {
            return Collections.unmodifiableList(new ArrayList<>(resultCache.values()));
        }
    }

    public void clearResults() {
        int size;
        synchronized (resultCache) {
            size = resultCache.size();
            resultCache.clear();
        }
        log.info("Backtest result cache cleared: {} entries removed", size);
    }

    // ==================== INTERNAL HELPERS ====================

    private BacktestResult execute(StrategyConfig config, MarketSnapshotProvider provider,
                                   LocalDate from, LocalDate to) {
        String runId = UUID.randomUUID().toString();
        long startMs = System.currentTimeMillis();
        try {
            BacktestEngine engine = new BacktestEngine(config, withCache(provider), from, to, runId,
                    properties.getTradingDaysPerYear());
            BacktestResult result = engine.run();
            cacheResult(result);
            return result;

        } catch (BacktestException e) {
            log.error("Backtest {} failed: {}", runId, e.getMessage());
            return failed(runId, config, from, to, e.getMessage(), startMs);

        } catch (Exception e) {
            log.error("Unexpected error in backtest {}: {}", runId, e.getMessage(), e);
            return failed(runId, config, from, to, "Unexpected error: " + e.getMessage(), startMs);
        }
    }

    private MarketSnapshotProvider withCache(MarketSnapshotProvider provider) {
        if (provider == null || properties.getSnapshotCacheSize() <= 0) {
            return provider;
        }
        return new CachingMarketSnapshotProvider(provider, properties.getSnapshotCacheSize());
    }

    private BacktestResult failed(String runId, StrategyConfig config, LocalDate from, LocalDate to,
                                  String message, long startMs) {
        BacktestResult result = BacktestResult.builder()
                .runId(runId)
                .strategyName(config.getName())
                .underlyingSymbol(config.getUnderlying())
                .status(BacktestStatus.FAILED)
                .errorMessage(message)
                .startDate(from)
                .endDate(to)
                .initialCapital(config.getRisk().getInitialCapital())
                .finalValue(config.getRisk().getInitialCapital())
                .trades(Collections.emptyList())
                .equityCurve(Collections.emptyList())
                .auditLog(Collections.emptyList())
                .executionDurationMs(System.currentTimeMillis() - startMs)
                .build();
        cacheResult(result);
        return result;
    }

    private void ensureEnabled() {
        if (!properties.isEnabled()) {
            throw new BacktestException(BacktestException.ErrorCode.BACKTEST_DISABLED,
                    "Backtest module is disabled in configuration");
        }
    }

    private void cacheResult(BacktestResult result) {
        synchronized (resultCache) {
            // Simple eviction: remove oldest if over limit
            while (!resultCache.isEmpty() && resultCache.size() >= properties.getResultCacheSize()) {
                String oldestKey = resultCache.keySet().iterator().next();
                resultCache.remove(oldestKey);
            }
            resultCache.put(result.getRunId(), result);
        }
    }
}
