package com.abusesentinel.core.engine;

import com.abusesentinel.core.model.BehaviorAnalysis;
import com.abusesentinel.core.model.ViolationRecord;

import java.util.List;

/**
 * Persists a subject's final state before the engine forgets it, on
 * disconnect or idle eviction.
 */
@FunctionalInterface
public interface SubjectArchiver {

    /**
     * @param subjectId  the departing subject
     * @param analysis   analysis at the moment of departure
     * @param violations retained violation history, oldest first
     */
    void archive(String subjectId, BehaviorAnalysis analysis, List<ViolationRecord> violations);
}
