package com.abusesentinel.core.config;

import java.util.List;

/**
 * Tick cadences and idle eviction.
 *
 * @since 1.0.0
 */
public class ScheduleConfig {

    private long microTickMillis = 1_000;
    private long macroTickMillis = 30_000;
    private long evictionIntervalMillis = 120_000;

    /** Subjects with no activity for this long are evicted by cleanup. */
    private double idleEvictionSeconds = 1800;

    void validate(List<String> errors) {
        if (microTickMillis <= 0) {
            errors.add("schedule.microTickMillis must be > 0");
        }
        if (macroTickMillis <= 0) {
            errors.add("schedule.macroTickMillis must be > 0");
        }
        if (evictionIntervalMillis <= 0) {
            errors.add("schedule.evictionIntervalMillis must be > 0");
        }
        if (!(idleEvictionSeconds > 0)) {
            errors.add("schedule.idleEvictionSeconds must be > 0");
        }
    }

    public long getMicroTickMillis() {
        return microTickMillis;
    }

    public void setMicroTickMillis(long microTickMillis) {
        this.microTickMillis = microTickMillis;
    }

    public long getMacroTickMillis() {
        return macroTickMillis;
    }

    public void setMacroTickMillis(long macroTickMillis) {
        this.macroTickMillis = macroTickMillis;
    }

    public long getEvictionIntervalMillis() {
        return evictionIntervalMillis;
    }

    public void setEvictionIntervalMillis(long evictionIntervalMillis) {
        this.evictionIntervalMillis = evictionIntervalMillis;
    }

    public double getIdleEvictionSeconds() {
        return idleEvictionSeconds;
    }

    public void setIdleEvictionSeconds(double idleEvictionSeconds) {
        this.idleEvictionSeconds = idleEvictionSeconds;
    }

    ScheduleConfig copy() {
        ScheduleConfig copy = new ScheduleConfig();
        copy.microTickMillis = microTickMillis;
        copy.macroTickMillis = macroTickMillis;
        copy.evictionIntervalMillis = evictionIntervalMillis;
        copy.idleEvictionSeconds = idleEvictionSeconds;
        return copy;
    }

    @Override
    public String toString() {
        return "ScheduleConfig{" +
                "microTickMillis=" + microTickMillis +
                ", macroTickMillis=" + macroTickMillis +
                ", evictionIntervalMillis=" + evictionIntervalMillis +
                ", idleEvictionSeconds=" + idleEvictionSeconds +
                '}';
    }
}
