package com.heronix.attendance.model.dto;

import java.time.LocalDateTime;

import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.enums.SessionStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for session operations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionResponseDTO {

    private Long sessionId;

    /**
     * Code to render as QR (e.g., "ATT_H7K2P9M3XQ4RZT8WNB6CJ5DKEV_X8").
     */
    private String code;

    private String subject;

    private String classroom;

    private SessionStatus status;

    private LocalDateTime createdAt;

    private LocalDateTime expiresAt;

    /**
     * Length of the scan window in seconds.
     */
    private long windowSeconds;

    private boolean closedEarly;

    private int markedCount;

    /**
     * Create from entity.
     */
    public static SessionResponseDTO fromEntity(AttendanceSession session) {
        return SessionResponseDTO.builder()
                .sessionId(session.getId())
                .code(session.getCode())
                .subject(session.getSubject())
                .classroom(session.getClassroom())
                .status(session.getStatus())
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .windowSeconds(session.getWindow().getSeconds())
                .closedEarly(session.isClosedEarly())
                .markedCount(session.getMarkedStudents().size())
                .build();
    }
}
