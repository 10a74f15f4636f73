package com.abusesentinel.core.engine;

/**
 * Decides whether a subject is governed by the privileged tier.
 */
@FunctionalInterface
public interface PrivilegeResolver {

    boolean isPrivileged(String subjectId);

    /**
     * @return a resolver under which nobody is privileged
     */
    static PrivilegeResolver none() {
        return subjectId -> false;
    }
}
