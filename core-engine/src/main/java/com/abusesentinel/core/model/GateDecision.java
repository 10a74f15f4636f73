package com.abusesentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a gating check.
 *
 * <p>
 * A denial is an ordinary result, not an error. It carries a human-readable
 * reason and the {@link DenialKind} that produced it.
 * </p>
 *
 * @since 1.0.0
 */
public final class GateDecision {

    private static final GateDecision ALLOWED = new GateDecision(true, "", null, null);

    private final boolean allowed;
    private final String reason;
    private final DenialKind kind;
    private final PolicyTier tier;

    private GateDecision(boolean allowed, String reason, DenialKind kind, PolicyTier tier) {
        this.allowed = allowed;
        this.reason = reason;
        this.kind = kind;
        this.tier = tier;
    }

    /**
     * @return an allow decision with no tier attached
     */
    public static GateDecision allow() {
        return ALLOWED;
    }

    /**
     * @param tier the tier whose policy allowed the request
     * @return an allow decision
     */
    public static GateDecision allow(PolicyTier tier) {
        return new GateDecision(true, "", null, tier);
    }

    /**
     * @param kind   the limit that was hit; must not be {@code null}
     * @param reason human-readable explanation; must not be {@code null}
     * @return a deny decision
     */
    public static GateDecision deny(DenialKind kind, String reason) {
        return new GateDecision(false,
                Objects.requireNonNull(reason, "reason must not be null"),
                Objects.requireNonNull(kind, "kind must not be null"),
                null);
    }

    /**
     * Return a copy of this decision tagged with the tier that evaluated it.
     *
     * @param tier the policy tier
     * @return tagged decision
     */
    public GateDecision withTier(PolicyTier tier) {
        return new GateDecision(allowed, reason, kind, tier);
    }

    public boolean isAllowed() {
        return allowed;
    }

    /**
     * @return the denial reason, or an empty string when allowed
     */
    public String getReason() {
        return reason;
    }

    public Optional<DenialKind> getKind() {
        return Optional.ofNullable(kind);
    }

    public Optional<PolicyTier> getTier() {
        return Optional.ofNullable(tier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GateDecision that))
            return false;
        return allowed == that.allowed
                && reason.equals(that.reason)
                && kind == that.kind
                && tier == that.tier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowed, reason, kind, tier);
    }

    @Override
    public String toString() {
        return allowed
                ? "GateDecision{allowed, tier=" + tier + '}'
                : "GateDecision{denied, kind=" + kind + ", tier=" + tier + ", reason='" + reason + "'}";
    }
}
