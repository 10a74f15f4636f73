package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.model.DenialKind;
import com.abusesentinel.core.model.EndpointPolicy;
import com.abusesentinel.core.model.GateDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;

/**
 * Sliding-window limiter with burst and cooldown controls.
 *
 * <h3>Implementation</h3>
 * <p>
 * Works on a caller-owned deque of request timestamps (epoch millis) for one
 * (subject, endpoint) pair. The deque is append-only and pruned from the
 * front, so it is always sorted ascending. On each evaluation the deque is
 * pruned to the policy window and three checks run in order:
 * </p>
 * <ol>
 * <li>cooldown since the last allowed request (skipped when the cooldown is
 * 0)</li>
 * <li>burst: requests inside the trailing one-second window</li>
 * <li>window: requests inside the trailing policy window</li>
 * </ol>
 * <p>
 * Evaluation never records the request; callers append with
 * {@link #record(Deque, long)} only after an allow, so denied attempts never
 * count against the window.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This class is <strong>stateless</strong>; all state lives in the deque.
 * </p>
 *
 * @since 1.0.0
 */
public class SlidingWindowLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(SlidingWindowLimiter.class);

    /** Length of the burst sub-window. */
    static final long BURST_WINDOW_MILLIS = 1_000L;

    /**
     * Decide whether one more request fits under {@code policy}.
     *
     * @param sequence  timestamps of previously allowed requests; pruned in
     *                  place
     * @param policy    the effective policy
     * @param nowMillis current time
     * @return the decision; a denial carries the reason and kind
     */
    public GateDecision evaluate(Deque<Long> sequence, EndpointPolicy policy, long nowMillis) {
        Objects.requireNonNull(sequence, "Request sequence must not be null");
        Objects.requireNonNull(policy, "EndpointPolicy must not be null");

        prune(sequence, policy.windowMillis(), nowMillis);

        long cooldownMillis = policy.cooldownMillis();
        if (cooldownMillis > 0 && !sequence.isEmpty()) {
            long sinceLast = nowMillis - sequence.peekLast();
            if (sinceLast < cooldownMillis) {
                double retryIn = (cooldownMillis - sinceLast) / 1_000d;
                LOG.debug("Cooldown denial: {}ms since last request, cooldown {}ms",
                        sinceLast, cooldownMillis);
                return GateDecision.deny(DenialKind.COOLDOWN, String.format(Locale.ROOT,
                        "Cooldown active, retry in %.3f seconds", retryIn));
            }
        }

        int burstCount = countSince(sequence, nowMillis - BURST_WINDOW_MILLIS);
        if (burstCount >= policy.getBurstLimit()) {
            LOG.debug("Burst denial: {} >= {}", burstCount, policy.getBurstLimit());
            return GateDecision.deny(DenialKind.BURST, String.format(Locale.ROOT,
                    "Burst limit exceeded: %d requests in 1 second (limit: %d)",
                    burstCount, policy.getBurstLimit()));
        }

        int windowCount = sequence.size();
        if (windowCount >= policy.getMaxRequests()) {
            LOG.debug("Window denial: {} >= {}", windowCount, policy.getMaxRequests());
            return GateDecision.deny(DenialKind.WINDOW, String.format(Locale.ROOT,
                    "Rate limit exceeded: %d requests in %.1f seconds (limit: %d)",
                    windowCount, policy.getWindowSeconds(), policy.getMaxRequests()));
        }

        return GateDecision.allow();
    }

    /**
     * Record an allowed request.
     *
     * @param sequence  the request sequence
     * @param nowMillis time of the allowed request
     */
    public void record(Deque<Long> sequence, long nowMillis) {
        Long last = sequence.peekLast();
        // keep the sequence sorted even if a caller's clock steps backwards
        sequence.addLast(last != null ? Math.max(last, nowMillis) : nowMillis);
    }

    /**
     * Drop every timestamp at or before {@code nowMillis - windowMillis}.
     *
     * @param sequence     the request sequence
     * @param windowMillis window length
     * @param nowMillis    current time
     */
    public static void prune(Deque<Long> sequence, long windowMillis, long nowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!sequence.isEmpty() && sequence.peekFirst() <= cutoff) {
            sequence.pollFirst();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static int countSince(Deque<Long> sequence, long exclusiveStart) {
        int count = 0;
        Iterator<Long> newestFirst = sequence.descendingIterator();
        while (newestFirst.hasNext() && newestFirst.next() > exclusiveStart) {
            count++;
        }
        return count;
    }
}
