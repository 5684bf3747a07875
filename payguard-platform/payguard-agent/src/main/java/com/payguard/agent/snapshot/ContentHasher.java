package com.payguard.agent.snapshot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * SHA-256 digests over normalized (sorted) content, so equal content always hashes equally
 * regardless of the order the platform returned it in.
 */
public final class ContentHasher {

    private ContentHasher() {}

    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hashInventory(Collection<String> packages) {
        return sha256(String.join("\n", new TreeSet<>(packages)));
    }

    public static String hashProperties(Map<String, String> properties) {
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(properties).forEach((key, value) -> sb.append(key).append('=').append(value).append('\n'));
        return sha256(sb.toString());
    }

    /**
     * Combined identity digest. Parts are joined with a separator that cannot appear in identifiers.
     */
    public static String hashIdentity(String... parts) {
        return sha256(String.join("\u0000", parts));
    }
}
