/**
 * The engine facade and its per-subject state.
 *
 * <p>
 * {@link com.abusesentinel.core.engine.AbusePreventionEngine} ties the rate
 * limiter and the behavioral scorers together. Hosts plug in through
 * {@link com.abusesentinel.core.engine.AnomalyListener},
 * {@link com.abusesentinel.core.engine.SubjectArchiver} and
 * {@link com.abusesentinel.core.engine.PrivilegeResolver}.
 * </p>
 */
package com.abusesentinel.core.engine;
