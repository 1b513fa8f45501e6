package com.heronix.attendance.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.enums.SessionStatus;

/**
 * Repository for AttendanceSession entity.
 *
 * The three {@link Modifying} statements are the only writers of session
 * status and membership after insert. Each one carries its precondition in
 * the WHERE clause so a concurrent writer can never be overwritten.
 */
@Repository
public interface AttendanceSessionRepository extends JpaRepository<AttendanceSession, Long> {

    /**
     * Find session by its scannable code.
     */
    Optional<AttendanceSession> findByCode(String code);

    /**
     * Check if a code is already taken.
     */
    boolean existsByCode(String code);

    /**
     * All sessions of an instructor, newest first.
     */
    List<AttendanceSession> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    /**
     * Sessions in which the student was counted present.
     */
    @Query("SELECT DISTINCT s FROM AttendanceSession s JOIN s.markedStudents m WHERE m = :studentId")
    List<AttendanceSession> findAttendedBy(@Param("studentId") String studentId);

    /**
     * Number of sessions ever held for a subject, across all instructors.
     */
    long countBySubject(String subject);

    long countByStatus(SessionStatus status);

    /**
     * Number of marks (0 or 1) a student holds on a session, read from committed state.
     */
    @Query("SELECT COUNT(m) FROM AttendanceSession s JOIN s.markedStudents m "
            + "WHERE s.id = :sessionId AND m = :studentId")
    long countMark(@Param("sessionId") Long sessionId, @Param("studentId") String studentId);

    /**
     * Add a student to a session only if, at the moment of the write, the
     * session is still ACTIVE, its window has not elapsed and the student is
     * not yet present.
     *
     * @return 1 if the student was added, 0 if the preconditions no longer hold
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "INSERT INTO session_marked_students (session_id, student_id) "
            + "SELECT s.id, :studentId FROM attendance_sessions s "
            + "WHERE s.id = :sessionId AND s.status = 'ACTIVE' AND s.expires_at > :now "
            + "AND NOT EXISTS (SELECT 1 FROM session_marked_students m "
            + "WHERE m.session_id = s.id AND m.student_id = :studentId)",
            nativeQuery = true)
    int insertMarkIfOpen(
            @Param("sessionId") Long sessionId,
            @Param("studentId") String studentId,
            @Param("now") LocalDateTime now);

    /**
     * Compare-and-set ACTIVE to EXPIRED for one session.
     *
     * @return 1 if this call performed the transition, 0 if it was already expired
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AttendanceSession s SET s.status = :expired, s.expiredAt = :now, "
            + "s.closedEarly = :closedEarly, s.updatedAt = :now "
            + "WHERE s.id = :sessionId AND s.status = :active")
    int expireIfActive(
            @Param("sessionId") Long sessionId,
            @Param("now") LocalDateTime now,
            @Param("closedEarly") boolean closedEarly,
            @Param("active") SessionStatus active,
            @Param("expired") SessionStatus expired);

    /**
     * Bulk expiry of every active session whose window has elapsed.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AttendanceSession s SET s.status = :expired, s.expiredAt = :now, s.updatedAt = :now "
            + "WHERE s.status = :active AND s.expiresAt <= :now")
    int expireElapsed(
            @Param("now") LocalDateTime now,
            @Param("active") SessionStatus active,
            @Param("expired") SessionStatus expired);
}
