package com.heronix.attendance.model.domain;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

import com.heronix.attendance.security.CallerIdentity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Display details of a student, as last seen on an authenticated scan.
 *
 * The identity provider owns students; this row only lets reports show a
 * name and email next to the opaque student id.
 */
@Entity
@Table(name = "student_profiles")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentProfile {

    @Id
    @Column(name = "id", length = CallerIdentity.MAX_ID_LENGTH)
    private String id;

    @NotBlank
    @Column(name = "name", nullable = false, length = CallerIdentity.MAX_NAME_LENGTH)
    private String name;

    @Column(name = "email", length = CallerIdentity.MAX_EMAIL_LENGTH)
    private String email;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
