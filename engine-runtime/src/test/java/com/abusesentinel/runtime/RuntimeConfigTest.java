package com.abusesentinel.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuntimeConfig}.
 */
class RuntimeConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldUseDefaults() {
        RuntimeConfig config = new RuntimeConfig.Builder().build();

        assertThat(config.getEngineConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.isHealthEnabled()).isTrue();
        assertThat(config.getShutdownTimeoutMs()).isEqualTo(5_000);
    }

    @Test
    @DisplayName("Should reject a port outside [1, 65535]")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> new RuntimeConfig.Builder().healthPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new RuntimeConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a negative shutdown timeout")
    void shouldRejectNegativeTimeout() {
        assertThatThrownBy(() -> new RuntimeConfig.Builder().shutdownTimeoutMs(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shutdownTimeoutMs");
    }

    @Test
    @DisplayName("Should require a config path, empty meaning default resolution")
    void shouldRejectNullPath() {
        assertThatThrownBy(() -> new RuntimeConfig.Builder().engineConfigPath(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}
