package com.payguard.agent.lock;

/**
 * Salted SHA-256 hash of an offline unlock PIN. The PIN itself is never stored.
 */
public record PinCredential(
        String hash,
        String salt
) {}
