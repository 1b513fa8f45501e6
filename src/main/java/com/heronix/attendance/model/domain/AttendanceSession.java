package com.heronix.attendance.model.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import com.heronix.attendance.model.enums.SessionStatus;
import com.heronix.attendance.security.CallerIdentity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One instructor-initiated attendance window.
 *
 * The session is the only shared mutable record in the engine. Students are
 * added to {@link #markedStudents} exclusively through the conditional insert
 * in {@code AttendanceSessionRepository#insertMarkIfOpen}, and the status only
 * moves ACTIVE to EXPIRED through the compare-and-set updates of the same
 * repository. Sessions are never deleted; they are the system of record for
 * reporting.
 */
@Entity
@Table(name = "attendance_sessions", indexes = {
    @Index(name = "idx_attendance_session_code", columnList = "code", unique = true),
    @Index(name = "idx_attendance_owner_created", columnList = "owner_id, created_at"),
    @Index(name = "idx_attendance_status", columnList = "status"),
    @Index(name = "idx_attendance_subject", columnList = "subject")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Instructor who opened the session.
     */
    @NotBlank
    @Column(name = "owner_id", nullable = false, updatable = false, length = 120)
    private String ownerId;

    @NotBlank
    @Column(name = "subject", nullable = false, updatable = false, length = 120)
    private String subject;

    @NotBlank
    @Column(name = "classroom", nullable = false, updatable = false, length = 120)
    private String classroom;

    /**
     * Scannable code. Format: PREFIX_HASH_CHECKSUM
     */
    @NotBlank
    @Size(max = 64)
    @Column(name = "code", nullable = false, unique = true, updatable = false, length = 64)
    private String code;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 15)
    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * End of the scan window (createdAt + window duration).
     */
    @NotNull
    @Column(name = "expires_at", nullable = false, updatable = false)
    private LocalDateTime expiresAt;

    /**
     * When the EXPIRED transition was persisted.
     */
    @Column(name = "expired_at")
    private LocalDateTime expiredAt;

    /**
     * Whether the owner closed the session before its window elapsed.
     */
    @Column(name = "closed_early", nullable = false)
    @Builder.Default
    private boolean closedEarly = false;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Ids of the students counted present.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "session_marked_students",
            joinColumns = @JoinColumn(name = "session_id"),
            uniqueConstraints = @UniqueConstraint(
                    name = "uk_session_marked_student", columnNames = {"session_id", "student_id"}))
    @Column(name = "student_id", nullable = false, length = CallerIdentity.MAX_ID_LENGTH)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Set<String> markedStudents = new HashSet<>();

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    /**
     * Check if the session accepts scans at the given instant.
     */
    public boolean isActiveAt(LocalDateTime now) {
        return status == SessionStatus.ACTIVE && now.isBefore(expiresAt);
    }

    public boolean hasMarked(String studentId) {
        return markedStudents != null && markedStudents.contains(studentId);
    }

    public Duration getWindow() {
        return Duration.between(createdAt, expiresAt);
    }
}
