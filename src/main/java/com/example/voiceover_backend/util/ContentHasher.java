package com.example.voiceover_backend.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of normalized text, as 64 lowercase hex characters. Equal fingerprints only
 * suggest equal text; callers compare the stored plaintext before trusting a match.
 */
public final class ContentHasher {
    private static final String ALGORITHM = "SHA-256";

    private ContentHasher() {}

    public static String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] bytes = digest.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
