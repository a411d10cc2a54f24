package com.counselbooking.common.util;

/**
 * Common constants used across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:schedule-day:";

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_NAME_HEADER = "X-Actor-Name";
    public static final String DEFAULT_ACTOR_NAME = "Admin";
}
