package com.abusesentinel.core.ratelimit;

import com.abusesentinel.core.model.DenialKind;
import com.abusesentinel.core.model.EndpointPolicy;
import com.abusesentinel.core.model.GateDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SlidingWindowLimiter}.
 */
class SlidingWindowLimiterTest {

    private SlidingWindowLimiter limiter;
    private Deque<Long> sequence;

    @BeforeEach
    void setUp() {
        limiter = new SlidingWindowLimiter();
        sequence = new ArrayDeque<>();
    }

    @Test
    @DisplayName("Should allow max requests then deny the next one in the window")
    void shouldDenyWhenWindowIsFull() {
        EndpointPolicy policy = new EndpointPolicy("test", 5, 10, 2, 0);

        for (long t : new long[] { 0, 1_000, 2_000, 3_000, 4_000 }) {
            assertThat(check(policy, t).isAllowed()).as("request at %d ms", t).isTrue();
        }

        GateDecision sixth = check(policy, 4_500);
        assertThat(sixth.isAllowed()).isFalse();
        assertThat(sixth.getKind()).contains(DenialKind.WINDOW);
        assertThat(sixth.getReason()).isEqualTo("Rate limit exceeded: 5 requests in 10.0 seconds (limit: 5)");
    }

    @Test
    @DisplayName("Should allow exactly burstLimit requests within one second")
    void shouldDenyWhenBurstIsExceeded() {
        EndpointPolicy policy = new EndpointPolicy("test", 5, 10, 2, 0);

        assertThat(check(policy, 0).isAllowed()).isTrue();
        assertThat(check(policy, 500).isAllowed()).isTrue();

        GateDecision third = check(policy, 800);
        assertThat(third.isAllowed()).isFalse();
        assertThat(third.getKind()).contains(DenialKind.BURST);
        assertThat(third.getReason()).isEqualTo("Burst limit exceeded: 2 requests in 1 second (limit: 2)");
    }

    @Test
    @DisplayName("Should enforce cooldown between consecutive allowed requests")
    void shouldEnforceCooldown() {
        EndpointPolicy policy = new EndpointPolicy("test", 10, 10, 5, 1.0);

        assertThat(check(policy, 0).isAllowed()).isTrue();

        GateDecision early = check(policy, 500);
        assertThat(early.isAllowed()).isFalse();
        assertThat(early.getKind()).contains(DenialKind.COOLDOWN);
        assertThat(early.getReason()).isEqualTo("Cooldown active, retry in 0.500 seconds");

        assertThat(check(policy, 1_000).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("Should never apply cooldown when it is zero")
    void shouldSkipZeroCooldown() {
        EndpointPolicy policy = new EndpointPolicy("test", 10, 10, 5, 0);

        assertThat(check(policy, 0).isAllowed()).isTrue();
        assertThat(check(policy, 0).isAllowed()).isTrue();
        assertThat(sequence).hasSize(2);
    }

    @Test
    @DisplayName("Should free capacity once old requests leave the window")
    void shouldPruneExpiredRequests() {
        EndpointPolicy policy = new EndpointPolicy("test", 2, 10, 2, 0);

        check(policy, 0);
        check(policy, 2_000);
        assertThat(check(policy, 5_000).isAllowed()).isFalse();

        // the request at t=0 expires exactly at t=10s
        assertThat(check(policy, 10_000).isAllowed()).isTrue();
        assertThat(sequence).containsExactly(2_000L, 10_000L);
    }

    @Test
    @DisplayName("Should keep every trailing window and second within limits under steady load")
    void shouldHoldWindowAndBurstInvariants() {
        EndpointPolicy policy = new EndpointPolicy("test", 7, 5, 3, 0.1);
        List<Long> allowed = new ArrayList<>();

        for (long t = 0; t < 30_000; t += 73) {
            if (check(policy, t).isAllowed()) {
                allowed.add(t);
            }
        }

        assertThat(allowed).isNotEmpty();
        for (int i = 0; i < allowed.size(); i++) {
            long end = allowed.get(i);
            long inWindow = allowed.stream().filter(t -> t > end - 5_000 && t <= end).count();
            long inSecond = allowed.stream().filter(t -> t > end - 1_000 && t <= end).count();
            assertThat(inWindow).isLessThanOrEqualTo(7);
            assertThat(inSecond).isLessThanOrEqualTo(3);
            if (i > 0) {
                assertThat(end - allowed.get(i - 1)).isGreaterThanOrEqualTo(100);
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private GateDecision check(EndpointPolicy policy, long nowMillis) {
        GateDecision decision = limiter.evaluate(sequence, policy, nowMillis);
        if (decision.isAllowed()) {
            limiter.record(sequence, nowMillis);
        }
        return decision;
    }
}
