package com.heronix.attendance.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.config.ClockConfig;
import com.heronix.attendance.exception.SessionConflictException;
import com.heronix.attendance.exception.SessionForbiddenException;
import com.heronix.attendance.exception.SessionNotFoundException;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.enums.SessionStatus;
import com.heronix.attendance.repository.AttendanceSessionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates attendance sessions and moves them from ACTIVE to EXPIRED.
 *
 * There is no timer: a session's window is checked against the caller's
 * {@code now} whenever it matters, and the EXPIRED transition is persisted
 * by whichever operation first observes the elapsed window.
 *
 * Methods are not transactional: every store call runs in its own short
 * transaction and a re-read sees committed state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleService {

    private static final int MAX_LABEL_LENGTH = 120;

    private final AttendanceSessionRepository sessionRepository;
    private final SessionCodeGenerator codeGenerator;
    private final AttendanceProperties properties;
    private final Clock clock;

    /**
     * Open a session with the configured default window.
     */
    public AttendanceSession openSession(String ownerId, String subject, String classroom) {
        return openSession(ownerId, subject, classroom, properties.getSession().getDefaultWindow());
    }

    /**
     * Open a new ACTIVE session with a fresh code.
     *
     * @param ownerId        instructor opening the session
     * @param subject        subject label
     * @param classroom      classroom label
     * @param windowDuration how long the code accepts scans
     * @return the persisted session
     * @throws SessionConflictException if every generated code collided
     */
    public AttendanceSession openSession(String ownerId, String subject, String classroom, Duration windowDuration) {
        requireLabel(ownerId, "ownerId");
        requireLabel(subject, "subject");
        requireLabel(classroom, "classroom");
        validateWindow(windowDuration);

        int maxAttempts = Math.max(1, properties.getCode().getMaxGenerationAttempts());
        SessionConflictException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                AttendanceSession session = insertSession(ownerId, subject.trim(), classroom.trim(), windowDuration);
                log.info("SESSION_LIFECYCLE: Opened session {} for {} ({} / {}) until {}",
                        session.getId(), ownerId, session.getSubject(), session.getClassroom(), session.getExpiresAt());
                return session;
            } catch (SessionConflictException e) {
                lastConflict = e;
                log.warn("SESSION_LIFECYCLE: Code collision on attempt {} of {}, regenerating", attempt, maxAttempts);
            }
        }

        throw lastConflict;
    }

    /**
     * True iff the session is ACTIVE and {@code now} is before the end of its window.
     */
    public boolean isActive(AttendanceSession session, LocalDateTime now) {
        return session.isActiveAt(now);
    }

    /**
     * Idempotently transition a session to EXPIRED.
     */
    public AttendanceSession expire(Long sessionId) {
        return expire(sessionId, now());
    }

    /**
     * Idempotently transition a session to EXPIRED, recording {@code now} as the
     * transition time if this call performs it.
     */
    public AttendanceSession expire(Long sessionId, LocalDateTime now) {
        int updated = sessionRepository.expireIfActive(
                sessionId, now, false, SessionStatus.ACTIVE, SessionStatus.EXPIRED);
        if (updated == 1) {
            log.info("SESSION_LIFECYCLE: Session {} expired", sessionId);
        }
        return findById(sessionId);
    }

    /**
     * Owner closes a session before (or after) its window elapsed.
     *
     * @throws SessionForbiddenException if {@code ownerId} does not own the session
     */
    public AttendanceSession closeSession(Long sessionId, String ownerId, LocalDateTime now) {
        AttendanceSession session = findById(sessionId);
        if (!session.getOwnerId().equals(ownerId)) {
            throw new SessionForbiddenException(
                    "Instructor " + ownerId + " does not own session " + sessionId);
        }
        if (session.getStatus() == SessionStatus.EXPIRED) {
            return session;
        }

        boolean early = now.isBefore(session.getExpiresAt());
        int updated = sessionRepository.expireIfActive(
                sessionId, now, early, SessionStatus.ACTIVE, SessionStatus.EXPIRED);
        if (updated == 1) {
            log.info("SESSION_LIFECYCLE: Session {} closed by owner {}{}", sessionId, ownerId,
                    early ? " before its window elapsed" : "");
        }
        return findById(sessionId);
    }

    public AttendanceSession findById(Long sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> SessionNotFoundException.forId(sessionId));
    }

    /**
     * All sessions of an instructor, newest first.
     */
    public List<AttendanceSession> listSessions(String ownerId) {
        return sessionRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    private AttendanceSession insertSession(String ownerId, String subject, String classroom, Duration window) {
        String code = codeGenerator.generate();
        if (sessionRepository.existsByCode(code)) {
            throw new SessionConflictException("Session code already in use: " + code);
        }

        LocalDateTime createdAt = now();
        AttendanceSession session = AttendanceSession.builder()
                .ownerId(ownerId)
                .subject(subject)
                .classroom(classroom)
                .code(code)
                .status(SessionStatus.ACTIVE)
                .createdAt(createdAt)
                .expiresAt(createdAt.plus(window))
                .build();

        try {
            return sessionRepository.saveAndFlush(session);
        } catch (DataIntegrityViolationException e) {
            throw new SessionConflictException("Session code rejected by store: " + code, e);
        }
    }

    private void validateWindow(Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Session window must be positive");
        }
        Duration max = properties.getSession().getMaxWindow();
        if (window.compareTo(max) > 0) {
            throw new IllegalArgumentException("Session window " + window + " exceeds maximum " + max);
        }
    }

    private static void requireLabel(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (value.trim().length() > MAX_LABEL_LENGTH) {
            throw new IllegalArgumentException(field + " must be at most " + MAX_LABEL_LENGTH + " characters");
        }
    }

    private LocalDateTime now() {
        return ClockConfig.utcNow(clock);
    }
}
