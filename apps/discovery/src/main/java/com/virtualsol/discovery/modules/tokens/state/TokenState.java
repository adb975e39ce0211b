package com.virtualsol.discovery.modules.tokens.state;

import java.util.Locale;
import java.util.Optional;

/**
 * Token lifecycle state.
 *
 * <p>{@link #getValue()} is the only representation written to the database, the cache and the
 * ranked index keys. {@link #fromValue(String)} accepts any casing plus the legacy labels
 * {@code new} and {@code graduating} still present in older rows.
 */
public enum TokenState {

    LAUNCHING("launching"),
    ABOUT_TO_BOND("about_to_bond"),
    BONDED("bonded"),
    ACTIVE("active"),
    DEAD("dead");

    private final String value;

    TokenState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<TokenState> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "new":
                return Optional.of(LAUNCHING);
            case "graduating":
                return Optional.of(ABOUT_TO_BOND);
            default:
                for (TokenState state : values()) {
                    if (state.value.equals(normalized)) {
                        return Optional.of(state);
                    }
                }
                return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
