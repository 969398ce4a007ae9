package com.plainer.collab.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

// Room passwords are kept as SHA-256 hex; invite and resume tokens are 128 random bits.
public final class CredentialHasher {

    private static final SecureRandom RANDOM = new SecureRandom();

    private CredentialHasher() {}

    public static String hash(String password) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(password.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean matches(String password, String expectedHash) {
        if (password == null || expectedHash == null) return false;
        return MessageDigest.isEqual(
            hash(password).getBytes(StandardCharsets.US_ASCII),
            expectedHash.getBytes(StandardCharsets.US_ASCII));
    }

    public static boolean tokenMatches(String presented, String expected) {
        if (presented == null || expected == null) return false;
        return MessageDigest.isEqual(
            presented.getBytes(StandardCharsets.UTF_8),
            expected.getBytes(StandardCharsets.UTF_8));
    }

    public static String newToken() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
