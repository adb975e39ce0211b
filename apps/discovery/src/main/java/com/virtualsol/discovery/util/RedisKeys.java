package com.virtualsol.discovery.util;

import com.virtualsol.discovery.modules.tokens.state.TokenState;

/**
 * Fast-store key namespace shared with the API process.
 */
public final class RedisKeys {

    public static final String TOKEN_PREFIX = "token:";
    public static final String RANKED_PREFIX = "tokens:";
    public static final String BUFFER_PREFIX = "token:buffer:";
    public static final String BUFFER_PENDING = "token:buffer:pending";
    public static final String ACTIVE_USERS = "system:active_users";
    public static final String LAST_ACTIVITY = "system:last_activity";
    public static final String PRICE_PREFIX = "price:";
    public static final String SOL_PRICE = PRICE_PREFIX + "SOL";

    private RedisKeys() {
    }

    public static String token(String mint) {
        return TOKEN_PREFIX + mint;
    }

    public static String ranked(TokenState state) {
        return RANKED_PREFIX + state.getValue();
    }

    public static String price(String mint) {
        return PRICE_PREFIX + mint;
    }

    public static String buffer(String mint) {
        return BUFFER_PREFIX + mint;
    }
}
