/**
 * Behavioral telemetry and scoring.
 *
 * <p>
 * A {@link com.abusesentinel.core.detection.BehaviorProfile} buffers each
 * subject's actions and movements.
 * {@link com.abusesentinel.core.detection.FeatureScorer} implementations turn
 * those buffers into per-feature scores, and
 * {@link com.abusesentinel.core.detection.AnomalyAggregator} combines them
 * into the anomaly and risk scores and a
 * {@link com.abusesentinel.core.model.BehaviorCategory}.
 * </p>
 */
package com.abusesentinel.core.detection;
