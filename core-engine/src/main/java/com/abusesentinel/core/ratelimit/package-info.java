/**
 * Request gating: sliding-window limits with burst and cooldown controls,
 * scaled per subject by an adaptive throttle.
 *
 * <p>
 * {@link com.abusesentinel.core.ratelimit.RateLimiterFacade} composes
 * {@link com.abusesentinel.core.ratelimit.EndpointPolicyTable},
 * {@link com.abusesentinel.core.ratelimit.AdaptiveThrottle} and
 * {@link com.abusesentinel.core.ratelimit.SlidingWindowLimiter} into a single
 * check-and-record call.
 * </p>
 *
 * @since 1.0.0
 */
package com.abusesentinel.core.ratelimit;
