package com.virtualsol.discovery.util;

import java.util.List;
import java.util.Locale;

/**
 * Normalizes the metadata and image links pump.fun tokens carry.
 */
public final class IpfsUrls {

    static final String GATEWAY = "https://ipfs.io/ipfs/";

    private static final String IPFS_SCHEME = "ipfs://";
    private static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".gif", ".webp", ".svg");

    private IpfsUrls() {
    }

    /**
     * Rewrites {@code ipfs://<cid>} to the public gateway. Other values are returned trimmed,
     * blanks as null.
     */
    public static String toHttp(String uri) {
        if (uri == null || uri.isBlank()) {
            return null;
        }
        String trimmed = uri.trim();
        if (trimmed.regionMatches(true, 0, IPFS_SCHEME, 0, IPFS_SCHEME.length())) {
            String path = trimmed.substring(IPFS_SCHEME.length());
            if (path.startsWith("ipfs/")) {
                path = path.substring("ipfs/".length());
            }
            return GATEWAY + path;
        }
        return trimmed;
    }

    /**
     * True when the path ends in a known image extension, ignoring any query string.
     */
    public static boolean isLikelyImage(String uri) {
        if (uri == null) {
            return false;
        }
        String path = uri.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        for (String extension : IMAGE_EXTENSIONS) {
            if (path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
