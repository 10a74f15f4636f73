package com.abusesentinel.core.model;

/**
 * Which limit denied a request.
 *
 * @since 1.0.0
 */
public enum DenialKind {
    COOLDOWN,
    BURST,
    WINDOW
}
