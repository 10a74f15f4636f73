/**
 * Configuration loading and validation for the abuse prevention engine.
 *
 * <p>
 * Tier limits, throttle escalation, scoring thresholds and tick cadences are
 * defined in YAML and loaded by
 * {@link com.abusesentinel.core.config.EngineConfigLoader} into an
 * {@link com.abusesentinel.core.config.EngineConfig} instance. Validation is
 * performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.abusesentinel.core.config;
