package io.borgqueue.core;

/**
 * Well-known lane names. A worker drains exactly one lane.
 */
public final class Lanes {

    public static final String DEFAULT = "default";

    /**
     * Lane for operations that need elevated rights on the host (self-update, certificates).
     */
    public static final String PRIVILEGED = "privileged";

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private Lanes() {
    }
}
