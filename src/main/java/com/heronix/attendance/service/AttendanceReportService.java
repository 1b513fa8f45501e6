package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.heronix.attendance.config.ClockConfig;
import com.heronix.attendance.exception.SessionForbiddenException;
import com.heronix.attendance.exception.SessionNotFoundException;
import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.domain.StudentProfile;
import com.heronix.attendance.model.dto.SessionDetailDTO;
import com.heronix.attendance.model.dto.StudentAttendanceDTO;
import com.heronix.attendance.model.dto.StudentHistoryDTO;
import com.heronix.attendance.model.dto.StudentSummaryDTO;
import com.heronix.attendance.model.dto.SubjectReportDTO;
import com.heronix.attendance.model.enums.SessionStatus;
import com.heronix.attendance.repository.AttendanceSessionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds attendance reports from the full session history.
 *
 * Reports are point-in-time snapshots and may miss marks that land while
 * they are being computed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceReportService {

    private final AttendanceSessionRepository sessionRepository;
    private final SessionLifecycleService lifecycleService;
    private final StudentDirectoryService studentDirectory;
    private final Clock clock;

    // ========================================================================
    // INSTRUCTOR REPORTS
    // ========================================================================

    /**
     * Per-subject statistics over every session owned by {@code ownerId}.
     *
     * @return subject to report, in alphabetical order of subject
     */
    public Map<String, SubjectReportDTO> reportFor(String ownerId) {
        List<AttendanceSession> sessions = sessionRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);

        AttendanceTally tally = new AttendanceTally();
        Set<String> studentIds = new HashSet<>();
        for (AttendanceSession session : sessions) {
            tally.addSession(session.getSubject(), session.getMarkedStudents());
            studentIds.addAll(session.getMarkedStudents());
        }

        Map<String, StudentProfile> profiles = studentDirectory.lookup(studentIds);

        Map<String, SubjectReportDTO> report = new LinkedHashMap<>();
        for (String subject : tally.subjects()) {
            int total = tally.totalSessions(subject);
            Map<String, StudentAttendanceDTO> students = new TreeMap<>();

            tally.attendanceCounts(subject).forEach((studentId, count) -> {
                StudentProfile profile = profiles.get(studentId);
                students.put(studentId, StudentAttendanceDTO.builder()
                        .name(profile != null ? profile.getName() : studentId)
                        .email(profile != null ? profile.getEmail() : null)
                        .attendanceCount(count)
                        .attendancePercentage(tally.percentage(subject, studentId))
                        .build());
            });

            report.put(subject, SubjectReportDTO.builder()
                    .totalSessions(total)
                    .students(students)
                    .build());
        }

        log.debug("Built report for {}: {} sessions across {} subjects", ownerId, sessions.size(), report.size());
        return report;
    }

    /**
     * Status and attendees of one session, for its owner only.
     */
    public SessionDetailDTO sessionDetail(Long sessionId, String ownerId) {
        return sessionDetail(sessionId, ownerId, ClockConfig.utcNow(clock));
    }

    /**
     * Status and attendees of one session, for its owner only. A session whose
     * window elapsed before {@code now} is expired before it is reported.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws SessionForbiddenException if {@code ownerId} does not own it
     */
    public SessionDetailDTO sessionDetail(Long sessionId, String ownerId, LocalDateTime now) {
        AttendanceSession session = lifecycleService.findById(sessionId);
        if (!session.getOwnerId().equals(ownerId)) {
            throw new SessionForbiddenException(
                    "Instructor " + ownerId + " does not own session " + sessionId);
        }

        if (session.getStatus() == SessionStatus.ACTIVE
                && !lifecycleService.isActive(session, now)) {
            session = lifecycleService.expire(sessionId, now);
        }

        Map<String, StudentProfile> profiles = studentDirectory.lookup(session.getMarkedStudents());
        List<StudentSummaryDTO> students = session.getMarkedStudents().stream()
                .map(id -> toSummary(id, profiles.get(id)))
                .sorted(Comparator.comparing(StudentSummaryDTO::getName).thenComparing(StudentSummaryDTO::getId))
                .collect(Collectors.toList());

        return SessionDetailDTO.builder()
                .sessionId(session.getId())
                .subject(session.getSubject())
                .classroom(session.getClassroom())
                .status(session.getStatus())
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .students(students)
                .build();
    }

    // ========================================================================
    // STUDENT HISTORY
    // ========================================================================

    /**
     * A student's attendance per subject they attended at least once.
     * totalClasses counts every session held for the subject.
     */
    public Map<String, StudentHistoryDTO> historyFor(String studentId) {
        Map<String, Integer> attendedBySubject = new TreeMap<>();
        for (AttendanceSession session : sessionRepository.findAttendedBy(studentId)) {
            attendedBySubject.merge(session.getSubject(), 1, Integer::sum);
        }

        Map<String, StudentHistoryDTO> history = new LinkedHashMap<>();
        attendedBySubject.forEach((subject, attended) -> {
            long total = sessionRepository.countBySubject(subject);
            history.put(subject, StudentHistoryDTO.builder()
                    .attended(attended)
                    .totalClasses(total)
                    .attendancePercentage(AttendanceTally.percentage(attended, total))
                    .build());
        });
        return history;
    }

    private static StudentSummaryDTO toSummary(String studentId, StudentProfile profile) {
        return StudentSummaryDTO.builder()
                .id(studentId)
                .name(profile != null ? profile.getName() : studentId)
                .email(profile != null ? profile.getEmail() : null)
                .build();
    }
}
