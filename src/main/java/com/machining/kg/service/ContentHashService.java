package com.machining.kg.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Service for generating content hashes used as node keys and index fingerprints.
 * Uses SHA-256 for deterministic, collision-resistant hashing.
 */
@Service
@Slf4j
public class ContentHashService {

    private static final String HASH_ALGORITHM = "SHA-256";

    /**
     * Generate SHA-256 hash from content string.
     * Returns 64-character hex string.
     *
     * @param content The text content to hash
     * @return 64-char hex hash, or null if content is null/empty
     */
    public String generateHash(String content) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        return bytesToHex(digest(content.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Hash an ordered tuple of values.
     * Every component is written as {@code <utf8-length>:<bytes>} so no choice of
     * values can make two different tuples produce the same input to the digest.
     * A null component is encoded as length -1.
     *
     * @param components tuple values, order significant
     * @return 64-char hex hash
     */
    public String hashTuple(List<String> components) {
        StringBuilder encoded = new StringBuilder();
        for (String component : components) {
            if (component == null) {
                encoded.append("-1:");
                continue;
            }
            byte[] bytes = component.getBytes(StandardCharsets.UTF_8);
            encoded.append(bytes.length).append(':').append(component);
        }
        return bytesToHex(digest(encoded.toString().getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Check if content has changed by comparing hashes.
     *
     * @param newHash Hash of newly computed content
     * @param existingHash Hash stored previously
     * @return true if content changed (hashes differ), false if unchanged
     */
    public boolean hasContentChanged(String newHash, String existingHash) {
        if (newHash == null && existingHash == null) {
            return false;
        }
        if (newHash == null || existingHash == null) {
            return true;
        }
        return !newHash.equals(existingHash);
    }

    private byte[] digest(byte[] input) {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM).digest(input);
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 algorithm not available", e);
            throw new IllegalStateException("Failed to generate content hash", e);
        }
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder(2 * bytes.length);
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
