package com.abusesentinel.core.model;

import java.util.Objects;

/**
 * One observed position/velocity report.
 *
 * @since 1.0.0
 */
public final class MovementSample {

    private final Vector3 position;
    private final Vector3 velocity;
    private final long timestampMillis;

    public MovementSample(Vector3 position, Vector3 velocity, long timestampMillis) {
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.velocity = velocity != null ? velocity : Vector3.ZERO;
        this.timestampMillis = timestampMillis;
    }

    public Vector3 getPosition() {
        return position;
    }

    public Vector3 getVelocity() {
        return velocity;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    @Override
    public String toString() {
        return "MovementSample{" + position + " v=" + velocity + " @" + timestampMillis + '}';
    }
}
