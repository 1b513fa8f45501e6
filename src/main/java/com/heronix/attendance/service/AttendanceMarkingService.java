package com.heronix.attendance.service;

import java.time.LocalDateTime;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.exception.AlreadyMarkedException;
import com.heronix.attendance.exception.SessionConflictException;
import com.heronix.attendance.exception.SessionExpiredException;
import com.heronix.attendance.exception.SessionNotFoundException;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.dto.MarkResultDTO;
import com.heronix.attendance.repository.AttendanceSessionRepository;
import com.heronix.attendance.security.CallerIdentity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records a student's presence against the session behind a scanned code.
 *
 * Each attempt reads the session, decides, and then writes with a single
 * conditional insert that re-checks status, window and membership inside the
 * store. A write that matches nothing means another writer got there first;
 * the attempt is discarded and the whole decision is made again from a fresh
 * read. No lock is taken.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceMarkingService {

    private final AttendanceSessionRepository sessionRepository;
    private final SessionLifecycleService lifecycleService;
    private final SessionCodeGenerator codeGenerator;
    private final AttendanceProperties properties;

    /**
     * Mark a student present for the session identified by {@code code}.
     *
     * @param code      scanned session code
     * @param studentId student being marked
     * @param now       scan instant
     * @return subject and classroom of the session for the confirmation
     * @throws SessionNotFoundException  if the code is malformed or unknown
     * @throws SessionExpiredException   if the session window has passed or it was closed
     * @throws AlreadyMarkedException    if the student is already counted
     * @throws SessionConflictException  if every attempt lost a race
     */
    public MarkResultDTO mark(String code, String studentId, LocalDateTime now) {
        if (studentId == null || studentId.isBlank()) {
            throw new IllegalArgumentException("studentId is required");
        }
        if (studentId.length() > CallerIdentity.MAX_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "studentId must be at most " + CallerIdentity.MAX_ID_LENGTH + " characters");
        }

        String trimmed = code == null ? null : code.trim();
        if (!codeGenerator.isWellFormed(trimmed)) {
            log.debug("ATTENDANCE_MARK: Rejected malformed code from student {}", studentId);
            throw SessionNotFoundException.forCode(trimmed);
        }

        int maxAttempts = Math.max(1, properties.getMarking().getMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AttendanceSession session = sessionRepository.findByCode(trimmed)
                    .orElseThrow(() -> SessionNotFoundException.forCode(trimmed));

            if (!lifecycleService.isActive(session, now)) {
                lifecycleService.expire(session.getId(), now);
                log.debug("ATTENDANCE_MARK: Student {} scanned expired session {}", studentId, session.getId());
                throw new SessionExpiredException(session.getId());
            }

            if (session.hasMarked(studentId)) {
                log.debug("ATTENDANCE_MARK: Student {} already marked for session {}", studentId, session.getId());
                throw new AlreadyMarkedException(session.getId(), studentId);
            }

            if (tryInsert(session.getId(), studentId, now)) {
                log.info("ATTENDANCE_MARK: Student {} marked for session {} ({})",
                        studentId, session.getId(), session.getSubject());
                return MarkResultDTO.builder()
                        .sessionId(session.getId())
                        .subject(session.getSubject())
                        .classroom(session.getClassroom())
                        .markedAt(now)
                        .build();
            }

            log.debug("ATTENDANCE_MARK: Conditional insert for student {} on session {} matched nothing "
                    + "(attempt {} of {}), re-reading", studentId, session.getId(), attempt, maxAttempts);
        }

        log.warn("ATTENDANCE_MARK: Giving up on student {} for code after {} attempts", studentId, maxAttempts);
        throw new SessionConflictException(
                "Could not mark student " + studentId + " after " + maxAttempts + " attempts");
    }

    /**
     * One conditional write. A lock failure, or an integrity violation caused
     * by a concurrent insert of the same mark, means another writer won and is
     * treated like a write that matched nothing. Any other integrity violation
     * is permanent and propagates.
     */
    private boolean tryInsert(Long sessionId, String studentId, LocalDateTime now) {
        try {
            return sessionRepository.insertMarkIfOpen(sessionId, studentId, now) == 1;
        } catch (ConcurrencyFailureException e) {
            log.debug("ATTENDANCE_MARK: Lock contention on session {} for student {}: {}",
                    sessionId, studentId, e.getMessage());
            return false;
        } catch (DataIntegrityViolationException e) {
            if (sessionRepository.countMark(sessionId, studentId) == 0) {
                log.error("ATTENDANCE_MARK: Store rejected mark of student {} on session {}: {}",
                        studentId, sessionId, e.getMessage());
                throw e;
            }
            log.debug("ATTENDANCE_MARK: Concurrent mark of student {} on session {} won", studentId, sessionId);
            return false;
        }
    }
}
