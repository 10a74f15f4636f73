package com.abusesentinel.core.detection;

import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.model.MovementSample;
import com.abusesentinel.core.model.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores recent positions for impossible speed and scripted paths.
 *
 * <h3>Speed</h3>
 * <p>
 * Every pair of consecutive positions whose implied speed exceeds
 * {@code maxSpeed} adds 0.2, up to 0.6. A position change with no elapsed time
 * counts as over-speed.
 * </p>
 *
 * <h3>Repeating paths</h3>
 * <p>
 * Displacements are reduced to unit directions rounded to one decimal. A
 * sliding window of {@code directionWindow} such directions that contains at
 * least two distinct directions and occurs more than
 * {@code directionRepeatThreshold} times adds 0.4. Zero displacements are
 * skipped, so standing still never looks like a pattern.
 * </p>
 *
 * @since 1.0.0
 */
public class MovementScorer implements FeatureScorer {

    private static final Logger LOG = LoggerFactory.getLogger(MovementScorer.class);

    public static final String NAME = "movement";

    static final double OVER_SPEED_STEP = 0.2;
    static final double OVER_SPEED_CAP = 0.6;
    static final double PATTERN_WEIGHT = 0.4;

    /** Displacements shorter than this are treated as no movement. */
    static final double MIN_DISPLACEMENT = 1e-6;

    private final ScoringConfig config;

    public MovementScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "ScoringConfig must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double score(BehaviorProfile profile, long nowMillis) {
        List<MovementSample> samples = new ArrayList<>(profile.movementSamples());
        if (samples.size() < config.getMinSamples()) {
            LOG.trace("Insufficient movements ({} < {}), skipping", samples.size(), config.getMinSamples());
            return 0;
        }

        int overSpeed = 0;
        List<Vector3> directions = new ArrayList<>();
        for (int i = 1; i < samples.size(); i++) {
            MovementSample prev = samples.get(i - 1);
            MovementSample curr = samples.get(i);
            Vector3 from = prev.getPosition();
            Vector3 to = curr.getPosition();
            double dx = to.getX() - from.getX();
            double dy = to.getY() - from.getY();
            double dz = to.getZ() - from.getZ();
            double distance = Math.hypot(Math.hypot(dx, dy), dz);
            if (distance < MIN_DISPLACEMENT) {
                continue;
            }
            long dtMillis = curr.getTimestampMillis() - prev.getTimestampMillis();
            // an overflowing jump is faster than any finite limit
            if (dtMillis <= 0 || !Double.isFinite(distance)
                    || distance / (dtMillis / 1_000d) > config.getMaxSpeed()) {
                overSpeed++;
            }
            if (Double.isFinite(distance)) {
                directions.add(roundedDirection(dx / distance, dy / distance, dz / distance));
            }
        }

        double score = Math.min(OVER_SPEED_CAP, overSpeed * OVER_SPEED_STEP);
        if (maxWindowRepeats(directions) > config.getDirectionRepeatThreshold()) {
            score += PATTERN_WEIGHT;
        }
        return Math.min(1.0, score);
    }

    private static Vector3 roundedDirection(double x, double y, double z) {
        return new Vector3(Math.round(x * 10) / 10.0, Math.round(y * 10) / 10.0, Math.round(z * 10) / 10.0);
    }

    private int maxWindowRepeats(List<Vector3> directions) {
        int window = config.getDirectionWindow();
        if (directions.size() < window) {
            return 0;
        }
        Map<List<Vector3>, Integer> counts = new HashMap<>();
        int top = 0;
        for (int i = 0; i + window <= directions.size(); i++) {
            List<Vector3> key = List.copyOf(directions.subList(i, i + window));
            if (new HashSet<>(key).size() < 2) {
                continue;
            }
            top = Math.max(top, counts.merge(key, 1, Integer::sum));
        }
        return top;
    }
}
