package com.tessera.modeling.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class EngineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("tessera.parallelism");
        System.clearProperty("tessera.solve.timeLimitSeconds");
        System.clearProperty("tessera.solve.nodeLimit");
    }

    @Test
    void shouldUseAvailableProcessorsByDefault() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.parallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.solveTimeLimit()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.solveNodeLimit()).isZero();
    }

    @Test
    void shouldReadSystemProperties() {
        System.setProperty("tessera.parallelism", "3");
        System.setProperty("tessera.solve.timeLimitSeconds", " 15 ");
        System.setProperty("tessera.solve.nodeLimit", "1000");

        EngineConfig config = EngineConfig.fromEnvironment();

        assertThat(config.parallelism()).isEqualTo(3);
        assertThat(config.solveTimeLimit()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.solveNodeLimit()).isEqualTo(1000);
    }

    @Test
    void shouldFallBackToDefaultOnUnparsableValue() {
        System.setProperty("tessera.solve.timeLimitSeconds", "ten");

        assertThat(EngineConfig.fromEnvironment().solveTimeLimit()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new EngineConfig(0, Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new EngineConfig(1, Duration.ZERO, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("time limit");
        assertThatThrownBy(() -> new EngineConfig(1, Duration.ofSeconds(1), -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("node limit");
    }

    @Test
    void shouldCopyWithChangedSetting() {
        EngineConfig config = new EngineConfig(2, Duration.ofSeconds(5), 10);

        assertThat(config.withParallelism(1)).isEqualTo(new EngineConfig(1, Duration.ofSeconds(5), 10));
        assertThat(config.withSolveTimeLimit(Duration.ofSeconds(9)).solveTimeLimit()).isEqualTo(Duration.ofSeconds(9));
    }

    @Test
    void shouldReturnDefaultForUnsetKey() {
        assertThat(EngineConfig.getEnvOrProperty("TESSERA_TEST_UNSET_KEY", "fallback")).isEqualTo("fallback");
    }
}
