package com.heronix.attendance.service;

import java.security.SecureRandom;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.heronix.attendance.config.AttendanceProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates the scannable code bound to one attendance session.
 *
 * Codes follow the format: PREFIX_HASH_CHECKSUM
 * Example: ATT_H7K2P9M3XQ4RZT8WNB6CJ5DKEV_X8
 *
 * - PREFIX: identifies attendance codes
 * - HASH: random chars from SecureRandom (26 of 32 symbols = 130 bits by default)
 * - CHECKSUM: 2 chars so garbage scans are rejected without a store lookup
 *
 * Uniqueness is not checked here; the store's unique constraint on the code
 * column rejects a duplicate insert.
 */
@Component
@Slf4j
public class SessionCodeGenerator {

    private static final String SEPARATOR = "_";
    private static final int CHECKSUM_LENGTH = 2;

    private final AttendanceProperties.CodeConfig config;
    private final SecureRandom secureRandom;

    @Autowired
    public SessionCodeGenerator(AttendanceProperties properties) {
        this(properties, new SecureRandom());
    }

    SessionCodeGenerator(AttendanceProperties properties, SecureRandom secureRandom) {
        this.config = properties.getCode();
        this.secureRandom = secureRandom;

        String prefix = config.getPrefix();
        if (prefix == null || prefix.isBlank() || prefix.contains(SEPARATOR)) {
            throw new IllegalStateException(
                    "Session code prefix '" + prefix + "' must be non-blank and must not contain '" + SEPARATOR + "'");
        }
        if (config.getHashCharset().contains(SEPARATOR)) {
            throw new IllegalStateException("Session code charset must not contain '" + SEPARATOR + "'");
        }

        double bits = entropyBits();
        if (bits < config.getMinEntropyBits()) {
            throw new IllegalStateException(String.format(
                    "Session code entropy %.1f bits is below the required %d bits (charset %d, length %d)",
                    bits, config.getMinEntropyBits(), config.getHashCharset().length(), config.getHashLength()));
        }
        log.debug("Session codes carry {} bits of entropy", String.format("%.1f", bits));
    }

    /**
     * Generate a fresh code.
     */
    public String generate() {
        String charset = config.getHashCharset();
        String hash = generateRandomHash(charset, config.getHashLength());
        String codeWithoutChecksum = config.getPrefix() + SEPARATOR + hash;
        return codeWithoutChecksum + SEPARATOR + calculateChecksum(codeWithoutChecksum, charset);
    }

    /**
     * Check prefix, lengths, alphabet and checksum of a scanned value.
     */
    public boolean isWellFormed(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }

        String[] parts = code.split(SEPARATOR, -1);
        if (parts.length != 3) {
            return false;
        }

        String prefix = parts[0];
        String hash = parts[1];
        String checksum = parts[2];

        if (!config.getPrefix().equals(prefix)) {
            return false;
        }
        if (hash.length() != config.getHashLength() || checksum.length() != CHECKSUM_LENGTH) {
            return false;
        }

        String charset = config.getHashCharset();
        for (char c : hash.toCharArray()) {
            if (charset.indexOf(c) < 0) {
                return false;
            }
        }

        return checksum.equals(calculateChecksum(prefix + SEPARATOR + hash, charset));
    }

    /**
     * Entropy of the random hash portion in bits.
     */
    public double entropyBits() {
        return config.getHashLength() * (Math.log(config.getHashCharset().length()) / Math.log(2));
    }

    private String generateRandomHash(String charset, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(charset.charAt(secureRandom.nextInt(charset.length())));
        }
        return sb.toString();
    }

    /**
     * Polynomial checksum for quick validation, not for security.
     */
    private String calculateChecksum(String input, String charset) {
        int crc = 0;
        for (char c : input.toCharArray()) {
            crc = (crc * 31 + c) % (charset.length() * charset.length());
        }
        char c1 = charset.charAt(crc / charset.length());
        char c2 = charset.charAt(crc % charset.length());
        return "" + c1 + c2;
    }
}
