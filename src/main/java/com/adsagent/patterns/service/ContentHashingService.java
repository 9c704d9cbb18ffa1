package com.adsagent.patterns.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content fingerprint for uploaded images, used as the dedup key per owner.
 */
@Service
public class ContentHashingService {

    private static final Logger logger = LoggerFactory.getLogger(ContentHashingService.class);

    private final MessageDigest digest;

    /**
     * Initializes the SHA-256 message digest used for content hashing.
     */
    public ContentHashingService() {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize SHA-256 MessageDigest", e);
            throw new IllegalStateException("Failed to initialize hashing service", e);
        }
    }

    /**
     * Calculates the SHA-256 hash of raw image bytes. Empty input is valid and always yields the same value.
     *
     * @param content raw bytes, never {@code null}
     * @return the digest as 64 lowercase hex characters
     */
    public synchronized String hash(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        return bytesToHex(digest.digest(content));
    }

    private String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
