package com.heronix.attendance.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import com.heronix.attendance.config.ClockConfig;
import com.heronix.attendance.exception.AlreadyMarkedException;
import com.heronix.attendance.exception.SessionForbiddenException;
import com.heronix.attendance.exception.StoreUnavailableException;
import com.heronix.attendance.model.dto.MarkResultDTO;
import com.heronix.attendance.model.dto.SessionDetailDTO;
import com.heronix.attendance.model.dto.SessionResponseDTO;
import com.heronix.attendance.model.dto.StudentHistoryDTO;
import com.heronix.attendance.model.dto.SubjectReportDTO;
import com.heronix.attendance.model.enums.CallerRole;
import com.heronix.attendance.security.CallerIdentity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the presentation layer: one method per user-facing operation.
 *
 * Every call takes the authenticated principal, checks its role, reads the
 * clock, and delegates to the engine services. Expected outcomes surface as
 * {@link com.heronix.attendance.exception.AttendanceException} subclasses;
 * store outages surface as {@link StoreUnavailableException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceEngineService {

    private final SessionLifecycleService lifecycleService;
    private final AttendanceMarkingService markingService;
    private final AttendanceReportService reportService;
    private final StudentDirectoryService studentDirectory;
    private final Clock clock;

    // ========================================================================
    // INSTRUCTOR OPERATIONS
    // ========================================================================

    public SessionResponseDTO openSession(CallerIdentity caller, String subject, String classroom) {
        requireRole(caller, CallerRole.INSTRUCTOR, "open a session");
        return callStore("openSession", () ->
                SessionResponseDTO.fromEntity(lifecycleService.openSession(caller.id(), subject, classroom)));
    }

    public SessionResponseDTO openSession(CallerIdentity caller, String subject, String classroom, Duration window) {
        requireRole(caller, CallerRole.INSTRUCTOR, "open a session");
        return callStore("openSession", () ->
                SessionResponseDTO.fromEntity(lifecycleService.openSession(caller.id(), subject, classroom, window)));
    }

    public SessionResponseDTO closeSession(CallerIdentity caller, Long sessionId) {
        requireRole(caller, CallerRole.INSTRUCTOR, "close a session");
        return callStore("closeSession", () ->
                SessionResponseDTO.fromEntity(lifecycleService.closeSession(sessionId, caller.id(), now())));
    }

    public List<SessionResponseDTO> listSessions(CallerIdentity caller) {
        requireRole(caller, CallerRole.INSTRUCTOR, "list sessions");
        return callStore("listSessions", () -> lifecycleService.listSessions(caller.id()).stream()
                .map(SessionResponseDTO::fromEntity)
                .collect(Collectors.toList()));
    }

    public SessionDetailDTO sessionDetail(CallerIdentity caller, Long sessionId) {
        requireRole(caller, CallerRole.INSTRUCTOR, "view a session");
        return callStore("sessionDetail", () -> reportService.sessionDetail(sessionId, caller.id(), now()));
    }

    public Map<String, SubjectReportDTO> reportFor(CallerIdentity caller) {
        requireRole(caller, CallerRole.INSTRUCTOR, "view reports");
        return callStore("reportFor", () -> reportService.reportFor(caller.id()));
    }

    // ========================================================================
    // STUDENT OPERATIONS
    // ========================================================================

    /**
     * Mark the calling student present for the session behind {@code code}.
     * The student's profile is refreshed only once the mark is recorded.
     */
    public MarkResultDTO mark(CallerIdentity caller, String code) {
        requireRole(caller, CallerRole.STUDENT, "mark attendance");
        return callStore("mark", () -> {
            MarkResultDTO result;
            try {
                result = markingService.mark(code, caller.id(), now());
            } catch (AlreadyMarkedException e) {
                log.info("ATTENDANCE_MARK: Duplicate scan by student {} on session {}", caller.id(), e.getSessionId());
                throw e;
            }
            studentDirectory.remember(caller);
            return result;
        });
    }

    public Map<String, StudentHistoryDTO> myAttendance(CallerIdentity caller) {
        requireRole(caller, CallerRole.STUDENT, "view own attendance");
        return callStore("myAttendance", () -> reportService.historyFor(caller.id()));
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void requireRole(CallerIdentity caller, CallerRole role, String action) {
        if (caller == null || !caller.hasRole(role)) {
            throw new SessionForbiddenException(
                    "Only " + role.name().toLowerCase() + "s may " + action);
        }
    }

    private <T> T callStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                | CannotCreateTransactionException e) {
            log.warn("ENGINE: Session store unavailable during {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Session store unavailable during " + operation, e);
        }
    }

    private LocalDateTime now() {
        return ClockConfig.utcNow(clock);
    }
}
