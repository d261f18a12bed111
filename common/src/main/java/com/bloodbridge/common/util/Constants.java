package com.bloodbridge.common.util;

/**
 * Constants shared by the web layer of every service.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    /** Header carrying the authenticated user id, set by the gateway. */
    public static final String USER_ID_HEADER = "X-User-Id";

    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;

    public static final int DEFAULT_LEADERBOARD_SIZE = 10;
    public static final int MAX_SEARCH_RESULTS = 20;
    public static final int MAX_LEADERBOARD_SIZE = 100;
}
