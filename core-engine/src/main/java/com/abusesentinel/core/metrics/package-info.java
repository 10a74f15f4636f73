/**
 * Micrometer meters published by the engine.
 *
 * @since 1.0.0
 */
package com.abusesentinel.core.metrics;
