package com.abusesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A single denied request, kept in the subject's violation history and handed
 * to the audit collaborator on archive.
 *
 * @since 1.0.0
 */
public final class ViolationRecord {

    private final String subjectId;
    private final String endpoint;
    private final String reason;
    private final DenialKind kind;
    private final Instant timestamp;

    @JsonCreator
    public ViolationRecord(@JsonProperty("subjectId") String subjectId,
            @JsonProperty("endpoint") String endpoint,
            @JsonProperty("reason") String reason,
            @JsonProperty("kind") DenialKind kind,
            @JsonProperty("timestamp") Instant timestamp) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId must not be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getReason() {
        return reason;
    }

    public DenialKind getKind() {
        return kind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ViolationRecord that))
            return false;
        return subjectId.equals(that.subjectId)
                && endpoint.equals(that.endpoint)
                && reason.equals(that.reason)
                && kind == that.kind
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, endpoint, reason, kind, timestamp);
    }

    @Override
    public String toString() {
        return "ViolationRecord{" +
                "subjectId='" + subjectId + '\'' +
                ", endpoint='" + endpoint + '\'' +
                ", kind=" + kind +
                ", reason='" + reason + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
