package com.traders.marketstream.websocket;

import java.util.Set;
import java.util.regex.Pattern;

public record CloseReason(int code, String reason) {
    public static final int NORMAL = 1000;
    public static final int ABNORMAL = 1006;

    private static final Set<Integer> AUTHENTICATION_CODES = Set.of(1008, 4401, 4403);
    private static final Pattern AUTHENTICATION_REASON =
            Pattern.compile("token (?:expired|invalid)|authentication failed", Pattern.CASE_INSENSITIVE);

    public static CloseReason abnormal(String reason) {
        return new CloseReason(ABNORMAL, reason);
    }

    /**
     * Closes the server uses to reject credentials. These are never retried.
     */
    public boolean isAuthenticationFailure() {
        return AUTHENTICATION_CODES.contains(code)
                || (reason != null && AUTHENTICATION_REASON.matcher(reason).find());
    }
}
