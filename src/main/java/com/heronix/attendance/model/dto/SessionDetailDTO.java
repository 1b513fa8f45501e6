package com.heronix.attendance.model.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.heronix.attendance.model.enums.SessionStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner's view of one session and the students who scanned it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionDetailDTO {

    private Long sessionId;

    private String subject;

    private String classroom;

    private SessionStatus status;

    private LocalDateTime createdAt;

    private LocalDateTime expiresAt;

    /**
     * Students counted present, ordered by name.
     */
    private List<StudentSummaryDTO> students;
}
