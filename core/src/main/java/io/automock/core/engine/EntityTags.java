package io.automock.core.engine;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Strong entity tags: the quoted lowercase SHA-1 hex digest of the payload. */
public final class EntityTags {

    private EntityTags() {
        // utility class
    }

    /** Returns {@code "<sha1-hex>"}, quotes included. */
    public static String strong(byte[] payload) {
        return "\"" + HexFormat.of().formatHex(sha1(payload)) + "\"";
    }

    private static byte[] sha1(byte[] payload) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(payload);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
