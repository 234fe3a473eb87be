package com.actiongate.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over canonical JSON.
 */
public class ArtifactHasher {

    private final CanonicalJson canonicalJson;

    public ArtifactHasher(CanonicalJson canonicalJson) {
        this.canonicalJson = canonicalJson;
    }

    public ArtifactHash hash(Object value) {
        return ArtifactHash.of(sha256Hex(canonicalJson.toCanonicalString(value)));
    }

    public CanonicalJson canonicalJson() {
        return canonicalJson;
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 unavailable", ex);
        }
    }
}
