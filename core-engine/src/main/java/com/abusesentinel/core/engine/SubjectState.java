package com.abusesentinel.core.engine;

import com.abusesentinel.core.config.ScoringConfig;
import com.abusesentinel.core.detection.BehaviorProfile;
import com.abusesentinel.core.ratelimit.RateLimitState;

/**
 * Everything the engine knows about one subject.
 */
public class SubjectState {

    private final String subjectId;
    private final RateLimitState rateLimit = new RateLimitState();
    private final BehaviorProfile profile;
    private long lastActivityMillis;

    SubjectState(String subjectId, ScoringConfig scoring, long createdMillis) {
        this.subjectId = subjectId;
        this.profile = new BehaviorProfile(scoring);
        this.lastActivityMillis = createdMillis;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public RateLimitState rateLimit() {
        return rateLimit;
    }

    public BehaviorProfile profile() {
        return profile;
    }

    public long getLastActivityMillis() {
        return lastActivityMillis;
    }

    void touch(long nowMillis) {
        lastActivityMillis = Math.max(lastActivityMillis, nowMillis);
    }
}
