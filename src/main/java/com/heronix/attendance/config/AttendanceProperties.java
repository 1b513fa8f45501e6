package com.heronix.attendance.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for Heronix Attendance.
 */
@Data
@ConfigurationProperties(prefix = "heronix.attendance")
public class AttendanceProperties {

    /**
     * Session window configuration
     */
    private SessionConfig session = new SessionConfig();

    /**
     * Session code configuration
     */
    private CodeConfig code = new CodeConfig();

    /**
     * Marking retry configuration
     */
    private MarkingConfig marking = new MarkingConfig();

    /**
     * Housekeeping sweep configuration
     */
    private SweepConfig sweep = new SweepConfig();

    @Data
    public static class SessionConfig {
        /**
         * Window used when the instructor does not pick one (QR stays valid for 2 minutes)
         */
        private Duration defaultWindow = Duration.ofMinutes(2);

        /**
         * Longest window an instructor may request
         */
        private Duration maxWindow = Duration.ofHours(4);
    }

    @Data
    public static class CodeConfig {
        /**
         * Prefix identifying attendance session codes
         */
        private String prefix = "ATT";

        /**
         * Characters allowed in the code hash (excludes ambiguous chars: I, O, 0, 1)
         */
        private String hashCharset = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

        /**
         * Length of the hash portion (26 chars of a 32-char alphabet = 130 bits)
         */
        private int hashLength = 26;

        /**
         * Codes below this entropy are refused at startup
         */
        private int minEntropyBits = 122;

        /**
         * Fresh codes tried when opening a session before a collision is reported
         */
        private int maxGenerationAttempts = 3;
    }

    @Data
    public static class MarkingConfig {
        /**
         * Conditional-update attempts per scan before reporting a conflict
         */
        private int maxAttempts = 3;
    }

    @Data
    public static class SweepConfig {
        /**
         * Enable the periodic expiry sweep (lazy expiry works without it)
         */
        private boolean enabled = false;

        /**
         * Delay between sweeps in milliseconds
         */
        private long fixedDelayMs = 60_000;
    }
}
