package com.virtualsol.discovery.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Mint address sanity checks applied by every ingress path before persistence.
 */
public final class MintValidator {

    private static final Pattern BASE58 = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    /**
     * Suffixes seen on vanity/placeholder addresses from the public feed.
     */
    private static final List<String> REJECTED_SUFFIXES = List.of("pump");

    private static final List<String> REJECTED_FRAGMENTS = List.of("undefined", "null");

    private MintValidator() {
    }

    public static boolean isValid(String mint) {
        if (mint == null || mint.isEmpty()) {
            return false;
        }
        String lower = mint.toLowerCase(Locale.ROOT);
        for (String fragment : REJECTED_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return false;
            }
        }
        for (String suffix : REJECTED_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return false;
            }
        }
        // whitespace is outside the alphabet, so the pattern rejects it
        return BASE58.matcher(mint).matches();
    }

    /**
     * First 8 characters, for log lines.
     */
    public static String abbreviate(String mint) {
        if (mint == null) {
            return "unknown";
        }
        return mint.length() <= 8 ? mint : mint.substring(0, 8);
    }
}
