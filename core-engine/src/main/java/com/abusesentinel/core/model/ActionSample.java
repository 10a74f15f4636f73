package com.abusesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One observed action invocation.
 *
 * @since 1.0.0
 */
public final class ActionSample {

    private final String actionType;
    private final Map<String, Object> data;
    private final long timestampMillis;

    /**
     * @param actionType      the action name; must not be {@code null}
     * @param data            free-form action payload, may be {@code null}
     * @param timestampMillis observation time
     */
    public ActionSample(String actionType, Map<String, Object> data, long timestampMillis) {
        this.actionType = Objects.requireNonNull(actionType, "actionType must not be null");
        this.data = data != null && !data.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
                : Collections.emptyMap();
        this.timestampMillis = timestampMillis;
    }

    public String getActionType() {
        return actionType;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    @Override
    public String toString() {
        return "ActionSample{" + actionType + " @" + timestampMillis + '}';
    }
}
