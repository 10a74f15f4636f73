package com.abusesentinel.runtime;

import com.abusesentinel.core.config.EngineConfig;
import com.abusesentinel.core.config.EngineConfigLoader;
import com.abusesentinel.core.config.ScheduleConfig;
import com.abusesentinel.core.engine.AbusePreventionEngine;
import com.abusesentinel.core.engine.TimeSource;
import com.abusesentinel.core.metrics.EngineMetrics;
import com.abusesentinel.core.model.BehaviorAnalysis;
import com.abusesentinel.core.model.GateDecision;
import com.abusesentinel.core.model.Vector3;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * Hosts an {@link AbusePreventionEngine} in a long-running process.
 *
 * <h3>Threading</h3>
 * <p>
 * The engine is not thread-safe. Every call, whether from a request handler
 * or from the tick scheduler, is serialized on this runtime's monitor, so
 * gating calls return synchronously and ticks never interleave with them.
 * Ticks run on one daemon thread.
 * </p>
 *
 * <h3>Schedule</h3>
 * <ul>
 * <li>{@code microTick} every {@code schedule.microTickMillis}</li>
 * <li>{@code macroTick} every {@code schedule.macroTickMillis}</li>
 * <li>{@code cleanup} every {@code schedule.evictionIntervalMillis}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class EngineRuntime implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EngineRuntime.class);

    private final AbusePreventionEngine engine;
    private final TimeSource time;
    private final long shutdownTimeoutMs;
    private final ScheduledExecutorService scheduler;
    private boolean started;

    public EngineRuntime(AbusePreventionEngine engine, TimeSource time, long shutdownTimeoutMs) {
        this.engine = Objects.requireNonNull(engine, "AbusePreventionEngine must not be null");
        this.time = Objects.requireNonNull(time, "TimeSource must not be null");
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "abuse-sentinel-ticks");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the periodic ticks. Calling it twice has no further effect.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        ScheduleConfig schedule = engine.config().getSchedule();
        schedule("micro", schedule.getMicroTickMillis(), engine::microTick);
        schedule("macro", schedule.getMacroTickMillis(), engine::macroTick);
        schedule("cleanup", schedule.getEvictionIntervalMillis(), engine::cleanup);
        started = true;
        LOG.info("Engine runtime started: micro={}ms macro={}ms cleanup={}ms",
                schedule.getMicroTickMillis(), schedule.getMacroTickMillis(),
                schedule.getEvictionIntervalMillis());
    }

    // ---------------------------------------------------------------
    // Serialized engine API
    // ---------------------------------------------------------------

    public synchronized GateDecision checkAndRecord(String subjectId, String endpoint) {
        return engine.checkAndRecord(subjectId, endpoint, time.nowMillis());
    }

    public synchronized void recordAction(String subjectId, String actionType, Map<String, Object> data) {
        engine.recordAction(subjectId, actionType, data, time.nowMillis());
    }

    public synchronized void recordMovement(String subjectId, Vector3 position, Vector3 velocity) {
        engine.recordMovement(subjectId, position, velocity, time.nowMillis());
    }

    public synchronized BehaviorAnalysis getAnalysis(String subjectId) {
        return engine.getAnalysis(subjectId);
    }

    public synchronized void onDisconnect(String subjectId) {
        engine.onDisconnect(subjectId);
    }

    /**
     * @return the document served at {@code /stats}
     */
    public synchronized Map<String, Object> stats() {
        EngineMetrics metrics = engine.metrics();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("trackedSubjects", engine.trackedSubjects());
        stats.put("allowedTotal", metrics.allowedTotal());
        stats.put("deniedTotal", metrics.deniedTotal());
        stats.put("anomaliesTotal", metrics.anomaliesTotal());
        stats.put("evictedTotal", metrics.evictedTotal());
        return stats;
    }

    /**
     * Stop the ticks and wait up to {@code shutdownTimeoutMs} for a running
     * tick to finish.
     */
    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Tick scheduler did not stop within {} ms, forcing shutdown", shutdownTimeoutMs);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Engine runtime stopped with {} tracked subject(s)", engine.trackedSubjects());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void schedule(String name, long periodMillis, LongConsumer tick) {
        scheduler.scheduleAtFixedRate(() -> runTick(name, tick), periodMillis, periodMillis,
                TimeUnit.MILLISECONDS);
    }

    /**
     * Run one tick under the monitor. A failing tick is logged and the next one
     * still runs, since an exception would cancel the schedule.
     */
    void runTick(String name, LongConsumer tick) {
        synchronized (this) {
            try {
                tick.accept(time.nowMillis());
            } catch (RuntimeException e) {
                LOG.error("{} tick failed: {}", name, e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Entry point
    // ---------------------------------------------------------------

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        RuntimeConfig config = RuntimeConfig.fromEnvironment();
        LOG.info("Starting abuse sentinel with config: {}", config);
        EngineConfig engineConfig = config.getEngineConfigPath().isBlank()
                ? EngineConfigLoader.load()
                : EngineConfigLoader.fromFile(config.getEngineConfigPath());

        // 2. Build the engine with the audit trail as listener and archiver
        AuditLogListener audit = new AuditLogListener();
        AbusePreventionEngine engine = AbusePreventionEngine.builder()
                .config(engineConfig)
                .anomalyListener(audit)
                .archiver(audit)
                .meterRegistry(new SimpleMeterRegistry())
                .build();

        // 3. Start ticks and the health server
        EngineRuntime runtime = new EngineRuntime(engine, TimeSource.system(), config.getShutdownTimeoutMs());
        runtime.start();
        HealthServer healthServer = new HealthServer(runtime::stats);
        if (config.isHealthEnabled()) {
            healthServer.start(config.getHealthPort());
        }

        // 4. Block until shutdown
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            healthServer.stop();
            runtime.close();
            stopped.countDown();
        }, "abuse-sentinel-shutdown"));
        stopped.await();
    }
}
