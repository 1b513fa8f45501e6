package com.heronix.attendance.model.dto;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Confirmation shown to a student after a successful scan.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarkResultDTO {

    private Long sessionId;

    private String subject;

    private String classroom;

    private LocalDateTime markedAt;
}
