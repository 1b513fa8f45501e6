package com.heronix.attendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.heronix.attendance.config.AttendanceProperties;

/**
 * Heronix Attendance - QR attendance session engine.
 *
 * An instructor opens a short-lived session for a class and students mark
 * themselves present by scanning the session's code. The engine owns the
 * session lifecycle, race-safe marking, and per-subject attendance reports.
 */
@SpringBootApplication
@EnableConfigurationProperties(AttendanceProperties.class)
@EnableScheduling
public class AttendanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttendanceApplication.class, args);
    }
}
