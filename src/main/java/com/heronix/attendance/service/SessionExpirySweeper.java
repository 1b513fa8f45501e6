package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.heronix.attendance.config.ClockConfig;
import com.heronix.attendance.model.enums.SessionStatus;
import com.heronix.attendance.repository.AttendanceSessionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically persists EXPIRED for sessions whose window has elapsed.
 *
 * Housekeeping only: scans and reports already apply expiry lazily.
 */
@Component
@ConditionalOnProperty(name = "heronix.attendance.sweep.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SessionExpirySweeper {

    private final AttendanceSessionRepository sessionRepository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${heronix.attendance.sweep.fixed-delay-ms:60000}")
    public void sweep() {
        int expired = sweepAt(ClockConfig.utcNow(clock));
        if (expired > 0) {
            log.info("EXPIRY_SWEEP: Expired {} elapsed sessions", expired);
        }
    }

    /**
     * Expire every ACTIVE session whose window ended at or before {@code now}.
     *
     * @return number of sessions transitioned
     */
    public int sweepAt(LocalDateTime now) {
        return sessionRepository.expireElapsed(now, SessionStatus.ACTIVE, SessionStatus.EXPIRED);
    }
}
