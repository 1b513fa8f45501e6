package com.heronix.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import com.heronix.attendance.config.MutableClock;
import com.heronix.attendance.exception.SessionExpiredException;
import com.heronix.attendance.model.dto.SessionResponseDTO;
import com.heronix.attendance.security.CallerIdentity;

/**
 * Session windows driven by a clock in a zone that falls back one hour
 * (America/New_York, 2025-11-02 06:00Z: 01:59 EDT is followed by 01:00 EST).
 */
@SpringBootTest
@ActiveProfiles("test")
class SessionWindowTimeZoneTest {

    private static final Instant BEFORE_FALL_BACK = Instant.parse("2025-11-02T05:59:00Z");

    private static final CallerIdentity PROF = CallerIdentity.instructor("prof-tz", "Grace Hopper", null);
    private static final CallerIdentity STUDENT = CallerIdentity.student("s-tz", "Sam", null);

    @TestConfiguration(proxyBeanMethods = false)
    static class NewYorkClockConfiguration {

        @Bean
        @Primary
        MutableClock newYorkClock() {
            return new MutableClock(BEFORE_FALL_BACK, ZoneId.of("America/New_York"));
        }
    }

    @Autowired
    private AttendanceEngineService engine;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.set(BEFORE_FALL_BACK);
    }

    @Test
    void windowElapsedAcrossFallBackIsExpired() {
        SessionResponseDTO session = engine.openSession(PROF, "Math", "B-204", Duration.ofMinutes(2));

        clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> engine.mark(STUDENT, session.getCode()))
                .isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void windowStillOpenAcrossFallBackAcceptsMark() {
        SessionResponseDTO session = engine.openSession(PROF, "Physics", "B-205", Duration.ofMinutes(2));

        clock.advance(Duration.ofMinutes(1));

        assertThat(engine.mark(STUDENT, session.getCode()).getSessionId()).isEqualTo(session.getSessionId());
    }

    @Test
    void sessionTimesAreStoredInUtc() {
        SessionResponseDTO session = engine.openSession(PROF, "Chemistry", "C-101", Duration.ofMinutes(2));

        assertThat(session.getCreatedAt()).isEqualTo("2025-11-02T05:59:00");
        assertThat(session.getExpiresAt()).isEqualTo("2025-11-02T06:01:00");
    }
}
