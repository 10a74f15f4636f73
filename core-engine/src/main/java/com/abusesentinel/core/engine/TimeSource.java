package com.abusesentinel.core.engine;

/**
 * Millisecond clock used by hosts to stamp engine calls.
 * <p>
 * The engine itself only ever receives explicit timestamps, so tests drive it
 * with fixed values and never need a clock.
 * </p>
 */
@FunctionalInterface
public interface TimeSource {

    long nowMillis();

    /**
     * Wall-clock anchored, but advanced by {@link System#nanoTime()} so that it
     * never runs backwards when the system clock is adjusted.
     *
     * @return a monotonic time source
     */
    static TimeSource system() {
        long originMillis = System.currentTimeMillis();
        long originNanos = System.nanoTime();
        return () -> originMillis + (System.nanoTime() - originNanos) / 1_000_000L;
    }
}
