package com.abusesentinel.core.metrics;

import com.abusesentinel.core.model.AnomalyEvent;
import com.abusesentinel.core.model.DenialKind;
import com.abusesentinel.core.model.PolicyTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Process-wide engine metrics.
 *
 * <p>
 * Meters are registered against the supplied {@link MeterRegistry}, which the
 * host wires to its reporter of choice (Prometheus, JMX, ...).
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code abuse_sentinel_requests_allowed_total{tier}}</li>
 * <li>{@code abuse_sentinel_requests_denied_total{tier,kind}}</li>
 * <li>{@code abuse_sentinel_anomalies_detected_total{source}}</li>
 * <li>{@code abuse_sentinel_subjects_evicted_total}</li>
 * <li>{@code abuse_sentinel_listener_failures_total}</li>
 * <li>{@code abuse_sentinel_tick_latency{cadence}} – timer per tick kind</li>
 * <li>{@code abuse_sentinel_tracked_subjects} – gauge</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class EngineMetrics {

    static final String ALLOWED = "abuse_sentinel_requests_allowed_total";
    static final String DENIED = "abuse_sentinel_requests_denied_total";
    static final String ANOMALIES = "abuse_sentinel_anomalies_detected_total";
    static final String EVICTED = "abuse_sentinel_subjects_evicted_total";
    static final String LISTENER_FAILURES = "abuse_sentinel_listener_failures_total";
    static final String TICK_LATENCY = "abuse_sentinel_tick_latency";
    static final String TRACKED = "abuse_sentinel_tracked_subjects";

    private final MeterRegistry registry;
    private final Counter evicted;
    private final Counter listenerFailures;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.evicted = Counter.builder(EVICTED)
                .description("Subjects whose state was evicted")
                .register(registry);
        this.listenerFailures = Counter.builder(LISTENER_FAILURES)
                .description("Exceptions thrown by anomaly listeners or archivers")
                .register(registry);
    }

    /**
     * Register the tracked-subjects gauge.
     *
     * @param trackedSubjects supplier of the current subject count
     */
    public void bindTrackedSubjects(Supplier<Number> trackedSubjects) {
        Gauge.builder(TRACKED, trackedSubjects)
                .description("Subjects with in-memory state")
                .register(registry);
    }

    public void incrementAllowed(PolicyTier tier) {
        Counter.builder(ALLOWED)
                .description("Requests allowed by the gate")
                .tag("tier", tag(tier))
                .register(registry)
                .increment();
    }

    public void incrementDenied(PolicyTier tier, DenialKind kind) {
        Counter.builder(DENIED)
                .description("Requests denied by the gate")
                .tag("tier", tag(tier))
                .tag("kind", tag(kind))
                .register(registry)
                .increment();
    }

    public void incrementAnomalies(AnomalyEvent.Source source) {
        Counter.builder(ANOMALIES)
                .description("Anomaly events emitted")
                .tag("source", tag(source))
                .register(registry)
                .increment();
    }

    public void incrementEvicted() {
        evicted.increment();
    }

    public void incrementListenerFailures() {
        listenerFailures.increment();
    }

    public void recordTick(String cadence, long nanos) {
        Timer.builder(TICK_LATENCY)
                .description("Time spent in one scheduled tick")
                .tag("cadence", cadence)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---------------------------------------------------------------
    // Readers
    // ---------------------------------------------------------------

    public long allowedTotal() {
        return sum(ALLOWED);
    }

    public long deniedTotal() {
        return sum(DENIED);
    }

    public long anomaliesTotal() {
        return sum(ANOMALIES);
    }

    public long evictedTotal() {
        return (long) evicted.count();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private long sum(String name) {
        return (long) registry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
