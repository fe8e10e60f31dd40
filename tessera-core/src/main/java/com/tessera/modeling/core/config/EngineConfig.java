package com.tessera.modeling.core.config;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Engine settings, read from system properties with environment-variable fallback.
 *
 * <ul>
 *   <li>{@code tessera.parallelism} / {@code TESSERA_PARALLELISM}: row-generation workers (default: available processors)</li>
 *   <li>{@code tessera.solve.timeLimitSeconds} / {@code TESSERA_SOLVE_TIME_LIMIT_SECONDS}: solver time limit (default: 60)</li>
 *   <li>{@code tessera.solve.nodeLimit} / {@code TESSERA_SOLVE_NODE_LIMIT}: solver node/iteration limit, 0 = unlimited (default: 0)</li>
 * </ul>
 */
public record EngineConfig(int parallelism, Duration solveTimeLimit, long solveNodeLimit) {
    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public EngineConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        if (solveTimeLimit.isNegative() || solveTimeLimit.isZero()) {
            throw new IllegalArgumentException("solve time limit must be positive, got " + solveTimeLimit);
        }
        if (solveNodeLimit < 0) {
            throw new IllegalArgumentException("solve node limit must not be negative, got " + solveNodeLimit);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(Runtime.getRuntime().availableProcessors(), Duration.ofSeconds(60), 0);
    }

    public static EngineConfig fromEnvironment() {
        EngineConfig defaults = defaults();
        int parallelism = parseInt("tessera.parallelism", "TESSERA_PARALLELISM", defaults.parallelism());
        long seconds = parseLong("tessera.solve.timeLimitSeconds", "TESSERA_SOLVE_TIME_LIMIT_SECONDS",
                defaults.solveTimeLimit().toSeconds());
        long nodes = parseLong("tessera.solve.nodeLimit", "TESSERA_SOLVE_NODE_LIMIT", defaults.solveNodeLimit());
        return new EngineConfig(parallelism, Duration.ofSeconds(seconds), nodes);
    }

    public EngineConfig withParallelism(int parallelism) {
        return new EngineConfig(parallelism, solveTimeLimit, solveNodeLimit);
    }

    public EngineConfig withSolveTimeLimit(Duration timeLimit) {
        return new EngineConfig(parallelism, timeLimit, solveNodeLimit);
    }

    private static int parseInt(String property, String env, int defaultValue) {
        return (int) parseLong(property, env, defaultValue);
    }

    private static long parseLong(String property, String env, long defaultValue) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            raw = System.getenv(env);
        }
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warning("Invalid value '" + raw + "' for " + property + ", using " + defaultValue);
            return defaultValue;
        }
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    public static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
