package com.abusesentinel.core.engine;

import com.abusesentinel.core.config.EngineConfig;
import com.abusesentinel.core.config.EngineConfigLoader;
import com.abusesentinel.core.config.TierConfig;
import com.abusesentinel.core.model.AdaptiveState;
import com.abusesentinel.core.model.AnomalyEvent;
import com.abusesentinel.core.model.BehaviorAnalysis;
import com.abusesentinel.core.model.BehaviorCategory;
import com.abusesentinel.core.model.DenialKind;
import com.abusesentinel.core.model.GateDecision;
import com.abusesentinel.core.model.PolicyTier;
import com.abusesentinel.core.model.Vector3;
import com.abusesentinel.core.model.ViolationRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AbusePreventionEngine}.
 */
class AbusePreventionEngineTest {

    private List<AnomalyEvent> events;
    private List<String> archived;
    private AbusePreventionEngine engine;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        archived = new ArrayList<>();
        engine = AbusePreventionEngine.builder()
                .anomalyListener(events::add)
                .archiver((subjectId, analysis, violations) -> archived.add(subjectId))
                .privilegeResolver(subjectId -> subjectId.startsWith("admin"))
                .build();
    }

    // ------------------------------------------------------------------
    // Gating
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should gate by endpoint tier and record violations")
    void shouldGateRequests() {
        assertThat(engine.checkAndRecord("alice", "PurchaseItem", 0).isAllowed()).isTrue();

        GateDecision denied = engine.checkAndRecord("alice", "PurchaseItem", 500);

        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getKind()).contains(DenialKind.COOLDOWN);
        assertThat(engine.getViolations("alice")).extracting(ViolationRecord::getEndpoint)
                .containsExactly("PurchaseItem");
        assertThat(engine.metrics().allowedTotal()).isEqualTo(1);
        assertThat(engine.metrics().deniedTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should consult the privilege resolver when no flag is given")
    void shouldResolvePrivilege() {
        assertThat(engine.checkAndRecord("admin-1", "PurchaseItem", 0).getTier()).contains(PolicyTier.PRIVILEGED);
        assertThat(engine.checkAndRecord("alice", "PurchaseItem", 0).getTier()).contains(PolicyTier.CRITICAL);
        assertThat(engine.checkAndRecord("alice", "PlaceItem", true, 0).getTier()).contains(PolicyTier.PRIVILEGED);
    }

    @Test
    @DisplayName("Should reject missing subject or endpoint names")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> engine.checkAndRecord(null, "PlaceItem", 0))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> engine.checkAndRecord("alice", " ", false, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.recordMovement("alice", null, null, 0))
                .isInstanceOf(NullPointerException.class);
        assertThat(engine.trackedSubjects()).isZero();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should answer queries about unknown subjects without creating state")
    void shouldNotCreateStateOnRead() {
        assertThat(engine.getAnalysis("ghost")).isEqualTo(BehaviorAnalysis.fresh("ghost"));
        assertThat(engine.getAdaptiveState("ghost")).isEqualTo(AdaptiveState.Snapshot.neutral());
        assertThat(engine.getViolations("ghost")).isEmpty();
        assertThat(engine.trackedSubjects()).isZero();
    }

    // ------------------------------------------------------------------
    // Scoring and feedback
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should raise a micro event that escalates the throttle, once per cooldown")
    void shouldFeedAnomaliesBackIntoThrottle() {
        recordBot("bot");

        engine.microTick(2_000);

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getSource()).isEqualTo(AnomalyEvent.Source.MICRO);
            assertThat(event.getSubjectId()).isEqualTo("bot");
            assertThat(event.getScore()).isCloseTo(0.8, within(1e-9));
            assertThat(event.getSubScores()).containsKeys("action", "timing", "movement");
        });
        assertThat(engine.getAdaptiveState("bot").getViolationCount()).isEqualTo(1);
        assertThat(engine.getAnalysis("bot").getAnomalyScore()).isCloseTo(0.8, within(1e-9));

        engine.microTick(3_000);
        assertThat(events).hasSize(1);
        assertThat(engine.metrics().anomaliesTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep scoring other subjects when one sends huge coordinates")
    void shouldScoreAlongsideHugeCoordinates() {
        for (int i = 0; i < 12; i++) {
            double x = i % 2 == 0 ? 1e308 : -1e308;
            engine.recordMovement("griefer", new Vector3(x, 0, 0), null, i * 100L);
        }
        recordBot("bot");

        engine.microTick(2_000);
        engine.macroTick(2_000);

        assertThat(events).extracting(AnomalyEvent::getSubjectId).contains("bot");
        assertThat(engine.getAnalysis("griefer").getAnomalyScore()).isCloseTo(0.15, within(1e-9));
        assertThat(engine.metrics().registry().get("abuse_sentinel_tick_latency")
                .tag("cadence", "micro").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not be affected by changes to the configuration after build")
    void shouldIsolateConfiguration() {
        EngineConfig config = EngineConfig.defaults();
        AbusePreventionEngine isolated = AbusePreventionEngine.builder()
                .config(config)
                .anomalyListener(events::add)
                .build();

        config.getScoring().setNgramSize(0);
        isolated.config().getScoring().setNgramSize(0);
        isolated.config().setTiers(List.of(new TierConfig("critical", 1, 1, 1, 0, List.of("PlaceItem"))));

        assertThat(isolated.config().getScoring().getNgramSize()).isEqualTo(3);
        assertThat(isolated.config().getTiers()).hasSize(4);
        recordBot(isolated, "bot");
        isolated.microTick(2_000);
        assertThat(events).singleElement()
                .satisfies(event -> assertThat(event.getScore()).isCloseTo(0.8, within(1e-9)));
    }

    @Test
    @DisplayName("Should raise a macro event only on an upward transition")
    void shouldRaiseMacroEventOnEscalation() {
        recordBot("bot");
        engine.microTick(2_000);

        engine.macroTick(2_000);
        engine.macroTick(2_500);

        assertThat(events).extracting(AnomalyEvent::getSource)
                .containsExactly(AnomalyEvent.Source.MICRO, AnomalyEvent.Source.MACRO);
        AnomalyEvent macro = events.get(1);
        assertThat(macro.getCategory()).isEqualTo(BehaviorCategory.EXPLOIT_ATTEMPT);
        assertThat(macro.getDetails()).contains("NORMAL").contains("EXPLOIT_ATTEMPT");

        BehaviorAnalysis analysis = engine.getAnalysis("bot");
        assertThat(analysis.getRiskScore()).isCloseTo(0.5, within(1e-9));
        assertThat(analysis.getBehaviorCategory()).isEqualTo(BehaviorCategory.EXPLOIT_ATTEMPT);
        assertThat(analysis.getSampleCount()).isEqualTo(32);
    }

    @Test
    @DisplayName("Should keep gating when the listener throws")
    void shouldSurviveListenerFailure() {
        AbusePreventionEngine fragile = AbusePreventionEngine.builder()
                .anomalyListener(event -> {
                    throw new IllegalStateException("listener down");
                })
                .build();
        recordBot(fragile, "bot");

        fragile.microTick(2_000);

        assertThat(fragile.getAdaptiveState("bot").getViolationCount()).isEqualTo(1);
        assertThat(fragile.metrics().registry().counter("abuse_sentinel_listener_failures_total").count())
                .isEqualTo(1.0);
        assertThat(fragile.checkAndRecord("bot", "Heartbeat", 2_000).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("Should run the macro tick from tick() only once its interval has elapsed")
    void shouldScheduleMacroTick() {
        recordBot("bot");

        engine.tick(2_000);
        engine.tick(31_999);
        assertThat(engine.getAnalysis("bot").getRiskScore()).isZero();

        engine.tick(32_000);
        assertThat(engine.getAnalysis("bot").getRiskScore()).isGreaterThan(0);
    }

    // ------------------------------------------------------------------
    // Eviction
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should archive then forget a disconnected subject")
    void shouldEvictOnDisconnect() {
        recordBot("bot");
        engine.checkAndRecord("bot", "PurchaseItem", 0);
        engine.checkAndRecord("bot", "PurchaseItem", 100);
        engine.microTick(2_000);

        engine.onDisconnect("bot");
        engine.onDisconnect("nobody");

        assertThat(archived).containsExactly("bot");
        assertThat(engine.trackedSubjects()).isZero();
        assertThat(engine.getAnalysis("bot")).isEqualTo(BehaviorAnalysis.fresh("bot"));
        assertThat(engine.getAdaptiveState("bot")).isEqualTo(AdaptiveState.Snapshot.neutral());
        assertThat(engine.getViolations("bot")).isEmpty();
        assertThat(engine.metrics().evictedTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should evict only subjects idle longer than idleEvictionSeconds")
    void shouldEvictIdleSubjects() {
        AbusePreventionEngine shortIdle = AbusePreventionEngine.builder()
                .config(EngineConfigLoader.fromClasspath("test-engine.yml"))
                .archiver((subjectId, analysis, violations) -> archived.add(subjectId))
                .build();
        shortIdle.checkAndRecord("idle", "Place", 0);
        shortIdle.checkAndRecord("active", "Place", 50_000);

        shortIdle.cleanup(60_001);

        assertThat(archived).containsExactly("idle");
        assertThat(shortIdle.trackedSubjects()).isEqualTo(1);
        assertThat(shortIdle.getAnalysis("idle")).isEqualTo(BehaviorAnalysis.fresh("idle"));
    }

    @Test
    @DisplayName("Should drop state even when the archiver fails")
    void shouldEvictWhenArchiverFails() {
        AbusePreventionEngine failing = AbusePreventionEngine.builder()
                .archiver((subjectId, analysis, violations) -> {
                    throw new IllegalStateException("store down");
                })
                .build();
        failing.checkAndRecord("alice", "PlaceItem", 0);

        failing.onDisconnect("alice");

        assertThat(failing.trackedSubjects()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void recordBot(String subjectId) {
        recordBot(engine, subjectId);
    }

    /**
     * 20 identical actions 0.1s apart plus 12 movements with three teleports:
     * micro score 0.8, trigram dominance 1.0.
     */
    private static void recordBot(AbusePreventionEngine target, String subjectId) {
        for (int i = 0; i < 20; i++) {
            target.recordAction(subjectId, "PlaceItem", Map.of("slot", i), i * 100L);
        }
        double x = 0;
        for (int i = 0; i < 12; i++) {
            x += i % 3 == 0 && i > 0 ? 500 : 1;
            target.recordMovement(subjectId, new Vector3(x, 0, 0), null, i * 100L);
        }
    }
}
