package com.traders.marketstream.normalize;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Root symbol extraction. {@code ESM4} and {@code ES} share the root {@code ES};
 * {@code M2KZ5} has the root {@code M2K}.
 */
public final class SymbolRoots {
    private static final Pattern FUTURES_CONTRACT = Pattern.compile("^([A-Z0-9]+?)([FGHJKMNQUVXZ])\\d");
    private static final Pattern LEADING_ALPHANUMERIC = Pattern.compile("^([A-Z0-9]+)");

    private SymbolRoots() {
    }

    /**
     * @return the root, or an empty string when the symbol is blank or has no leading alphanumerics
     */
    public static String root(String symbol) {
        if (symbol == null) {
            return "";
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return "";
        }
        Matcher contract = FUTURES_CONTRACT.matcher(normalized);
        if (contract.find()) {
            return contract.group(1);
        }
        Matcher head = LEADING_ALPHANUMERIC.matcher(normalized);
        return head.find() ? head.group(1) : "";
    }

    /**
     * True when either side has no root or both roots are equal.
     */
    public static boolean compatible(String left, String right) {
        String leftRoot = root(left);
        String rightRoot = root(right);
        return leftRoot.isEmpty() || rightRoot.isEmpty() || leftRoot.equals(rightRoot);
    }

    public static boolean sameRoot(String left, String right) {
        String leftRoot = root(left);
        return !leftRoot.isEmpty() && leftRoot.equals(root(right));
    }

    /**
     * Decides whether an event labelled with {@code topicSymbol} and carrying {@code payloadSymbol}
     * belongs to a subscription on {@code expectedSymbol}. Comparison is case-insensitive and by root;
     * an absent symbol is no evidence either way.
     */
    public static boolean isMismatch(String topicSymbol, String payloadSymbol, String expectedSymbol) {
        String topic = normalize(topicSymbol);
        String payload = normalize(payloadSymbol);
        if (topic != null && payload != null && !topic.equals(payload)) {
            String topicRoot = root(topic);
            if (topicRoot.isEmpty() || !topicRoot.equals(root(payload))) {
                return true;
            }
        }
        String expected = normalize(expectedSymbol);
        if (expected == null) {
            return false;
        }
        return !agrees(topic, expected) || !agrees(payload, expected);
    }

    private static boolean agrees(String observed, String expected) {
        if (observed == null || observed.equals(expected)) {
            return true;
        }
        return sameRoot(observed, expected);
    }

    private static String normalize(String symbol) {
        if (symbol == null) {
            return null;
        }
        String trimmed = symbol.trim().toUpperCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }
}
