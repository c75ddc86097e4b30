package com.shortlink.jobs;

import java.util.Arrays;
import java.util.Optional;

/**
 * Jobs registered with the scheduler. {@link #key()} is the name used by administrative callers.
 */
public enum JobName {

    URL_EXPIRATION("urlExpiration", "URL expiration"),
    PASSWORD_RESET_CLEANUP("passwordResetCleanup", "Password reset cleanup");

    /** Selector accepted by statistics reset to address every job. */
    public static final String ALL = "all";

    private final String key;
    private final String displayName;

    JobName(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<JobName> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String k = key.strip();
        return Arrays.stream(values()).filter(n -> n.key.equalsIgnoreCase(k)).findFirst();
    }
}
