/**
 * Domain model classes for Abuse Sentinel.
 *
 * <p>
 * Values shared between the rate limiter, the behavior analyzer and the
 * external collaborators:
 * </p>
 * <ul>
 * <li>{@link com.abusesentinel.core.model.EndpointPolicy} and
 * {@link com.abusesentinel.core.model.PolicyTier}: limit profiles</li>
 * <li>{@link com.abusesentinel.core.model.GateDecision}: result of a gating
 * check</li>
 * <li>{@link com.abusesentinel.core.model.AdaptiveState}: per-subject throttle
 * escalation</li>
 * <li>{@link com.abusesentinel.core.model.BehaviorAnalysis} and
 * {@link com.abusesentinel.core.model.AnomalyEvent}: behavioral scoring
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.abusesentinel.core.model;
