package com.abusesentinel.runtime;

import java.util.Objects;

/**
 * Typed, immutable configuration for the engine host process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the runtime is configurable via container env vars or a shell environment.
 * Engine tuning itself lives in the YAML file named by
 * {@code ABUSE_SENTINEL_CONFIG}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuntimeConfig {

    private final String engineConfigPath;
    private final int healthPort;
    private final boolean healthEnabled;
    private final long shutdownTimeoutMs;

    private RuntimeConfig(Builder b) {
        this.engineConfigPath = b.engineConfigPath;
        this.healthPort = b.healthPort;
        this.healthEnabled = b.healthEnabled;
        this.shutdownTimeoutMs = b.shutdownTimeoutMs;
    }

    /**
     * Build a {@link RuntimeConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RuntimeConfig fromEnvironment() {
        try {
            return new Builder()
                    .engineConfigPath(env("ABUSE_SENTINEL_CONFIG", ""))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .healthEnabled(Boolean.parseBoolean(env("HEALTH_ENABLED", "true")))
                    .shutdownTimeoutMs(Long.parseLong(env("SHUTDOWN_TIMEOUT_MS", "5000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return path of the engine YAML, or an empty string to use the default
     *         resolution
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public boolean isHealthEnabled() {
        return healthEnabled;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RuntimeConfig}.
     */
    public static class Builder {
        private String engineConfigPath = "";
        private int healthPort = 8080;
        private boolean healthEnabled = true;
        private long shutdownTimeoutMs = 5_000;

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder healthEnabled(boolean v) {
            this.healthEnabled = v;
            return this;
        }

        public Builder shutdownTimeoutMs(long v) {
            this.shutdownTimeoutMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RuntimeConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RuntimeConfig build() {
            Objects.requireNonNull(engineConfigPath, "engineConfigPath required (use \"\" for default)");
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (shutdownTimeoutMs < 0) {
                throw new IllegalArgumentException(
                        "shutdownTimeoutMs must be >= 0, got: " + shutdownTimeoutMs);
            }
            return new RuntimeConfig(this);
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "RuntimeConfig{" +
                "engineConfigPath='" + engineConfigPath + '\'' +
                ", healthPort=" + healthPort +
                ", healthEnabled=" + healthEnabled +
                ", shutdownTimeoutMs=" + shutdownTimeoutMs +
                '}';
    }
}
