package com.heronix.attendance.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.heronix.attendance.model.enums.SessionStatus;
import com.heronix.attendance.repository.AttendanceSessionRepository;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the session store.
 *
 * Reports UP with the number of open sessions when the store answers,
 * DOWN when it is unreachable.
 */
@Component
@RequiredArgsConstructor
public class SessionStoreHealthIndicator implements HealthIndicator {

    private final AttendanceSessionRepository sessionRepository;

    @Override
    public Health health() {
        try {
            long active = sessionRepository.countByStatus(SessionStatus.ACTIVE);
            return Health.up()
                    .withDetail("store", "reachable")
                    .withDetail("active-sessions", active)
                    .build();
        } catch (DataAccessException e) {
            return Health.down(e)
                    .withDetail("store", "unreachable")
                    .build();
        }
    }
}
