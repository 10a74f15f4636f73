package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.model.AdaptiveState;
import com.abusesentinel.core.model.ViolationRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Rate-limiting state owned by one subject: request sequences per endpoint,
 * the adaptive throttle state and the violation history.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; owned and mutated by a single subject's calls.
 * </p>
 *
 * @since 1.0.0
 */
public class RateLimitState {

    private final Map<String, Deque<Long>> requestLog = new HashMap<>();
    private final AdaptiveState adaptive = new AdaptiveState();
    private final Deque<ViolationRecord> violations = new ArrayDeque<>();

    /**
     * @param endpoint endpoint name
     * @return the request sequence for {@code endpoint}, created on first use
     */
    public Deque<Long> requests(String endpoint) {
        return requestLog.computeIfAbsent(endpoint, k -> new ArrayDeque<>());
    }

    public AdaptiveState adaptive() {
        return adaptive;
    }

    public void addViolation(ViolationRecord record) {
        violations.addLast(record);
    }

    /**
     * @return unmodifiable copy of the violation history, oldest first
     */
    public List<ViolationRecord> violations() {
        return Collections.unmodifiableList(new ArrayList<>(violations));
    }

    /**
     * @param sinceMillis inclusive lower bound
     * @return number of violations at or after {@code sinceMillis}
     */
    public int violationsSince(long sinceMillis) {
        int count = 0;
        Iterator<ViolationRecord> newestFirst = violations.descendingIterator();
        while (newestFirst.hasNext()
                && newestFirst.next().getTimestamp().toEpochMilli() >= sinceMillis) {
            count++;
        }
        return count;
    }

    /**
     * Drop violations older than the retention period.
     *
     * @param retentionMillis how long violations are kept
     * @param nowMillis       current time
     */
    public void pruneViolations(long retentionMillis, long nowMillis) {
        long cutoff = nowMillis - retentionMillis;
        while (!violations.isEmpty() && violations.peekFirst().getTimestamp().toEpochMilli() < cutoff) {
            violations.pollFirst();
        }
    }

    /**
     * Prune every request sequence to {@code windowMillis} and remove the
     * ones left empty.
     *
     * @param windowMillis longest window any endpoint could be using
     * @param nowMillis    current time
     */
    public void pruneRequests(long windowMillis, long nowMillis) {
        Iterator<Deque<Long>> it = requestLog.values().iterator();
        while (it.hasNext()) {
            Deque<Long> sequence = it.next();
            SlidingWindowLimiter.prune(sequence, windowMillis, nowMillis);
            if (sequence.isEmpty()) {
                it.remove();
            }
        }
    }

    public int trackedEndpoints() {
        return requestLog.size();
    }
}
