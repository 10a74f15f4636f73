package com.abusesentinel.core.engine;

import com.abusesentinel.core.config.ScoringConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory map of subject id to {@link SubjectState}.
 * <p>
 * A missing entry always means a fresh subject, so removing an entry is a
 * complete reset. Not thread-safe.
 * </p>
 */
public class SubjectStateStore {

    private final Map<String, SubjectState> states = new HashMap<>();
    private final ScoringConfig scoring;

    public SubjectStateStore(ScoringConfig scoring) {
        this.scoring = Objects.requireNonNull(scoring, "ScoringConfig must not be null");
    }

    /**
     * @return the subject's state, created on first use
     */
    public SubjectState getOrCreate(String subjectId, long nowMillis) {
        return states.computeIfAbsent(subjectId, id -> new SubjectState(id, scoring, nowMillis));
    }

    public Optional<SubjectState> find(String subjectId) {
        return Optional.ofNullable(states.get(subjectId));
    }

    public Optional<SubjectState> remove(String subjectId) {
        return Optional.ofNullable(states.remove(subjectId));
    }

    /**
     * @return a copy of the current states, safe to iterate while the store
     *         is modified
     */
    public List<SubjectState> snapshot() {
        return new ArrayList<>(states.values());
    }

    public int size() {
        return states.size();
    }
}
