package com.optionsbacktest.backtest.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.optionsbacktest.backtest.engine.BacktestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads strategy documents (YAML, or JSON which YAML accepts) into a validated
 * {@link StrategyConfig}.
 * <p>
 * Keys are snake_case. Unknown keys and wrongly typed values are rejected rather than
 * ignored, so a typo in a threshold name cannot silently disable a rule.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StrategyConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS);

    private final StrategyConfigValidator validator;

    public StrategyConfig load(Path path) {
        log.info("Loading strategy configuration from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new BacktestException(BacktestException.ErrorCode.CONFIG_LOAD_FAILED,
                    "Cannot read strategy configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public StrategyConfig load(InputStream in, String sourceName) {
        try {
            StrategyConfig config = MAPPER.readValue(in, StrategyConfig.class);
            if (config == null) {
                throw new ConfigValidationException(List.of(sourceName + " is empty"));
            }
            validator.validate(config);
            log.info("Loaded strategy '{}' from {}: {} exit rule(s), filters={}",
                    config.getName(), sourceName, config.getExitRules().size(), config.hasMarketFilters());
            return config;
        } catch (JsonProcessingException e) {
            throw malformed(sourceName, e);
        } catch (IOException e) {
            throw new BacktestException(BacktestException.ErrorCode.CONFIG_LOAD_FAILED,
                    "Cannot read strategy configuration " + sourceName + ": " + e.getMessage(), e);
        }
    }

    public StrategyConfig parse(String document) {
        try {
            StrategyConfig config = MAPPER.readValue(document, StrategyConfig.class);
            if (config == null) {
                throw new ConfigValidationException(List.of("document is empty"));
            }
            validator.validate(config);
            return config;
        } catch (JsonProcessingException e) {
            throw malformed("inline document", e);
        }
    }

    private static ConfigValidationException malformed(String source, JsonProcessingException e) {
        log.error("Malformed strategy configuration {}: {}", source, e.getOriginalMessage());
        return new ConfigValidationException(source + ": " + e.getOriginalMessage(), e);
    }
}
