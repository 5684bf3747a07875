package com.payguard.agent.lock;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Hashes and verifies offline unlock PINs.
 */
public class PinHasher {

    private static final int SALT_BYTES = 16;

    private final SecureRandom random = new SecureRandom();

    public PinCredential hash(String pin) {
        if (pin == null || pin.isBlank()) {
            throw new IllegalArgumentException("PIN cannot be blank");
        }
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        String encodedSalt = Base64.getEncoder().encodeToString(salt);
        return new PinCredential(digest(encodedSalt, pin), encodedSalt);
    }

    /**
     * Constant-time comparison against a stored hash.
     */
    public boolean matches(String pin, String expectedHash, String salt) {
        if (pin == null || expectedHash == null || salt == null) {
            return false;
        }
        byte[] actual = digest(salt, pin).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(actual, expectedHash.getBytes(StandardCharsets.UTF_8));
    }

    private static String digest(String salt, String pin) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(Base64.getDecoder().decode(salt));
            return HexFormat.of().formatHex(digest.digest(pin.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
