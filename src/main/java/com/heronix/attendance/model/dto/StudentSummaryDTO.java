package com.heronix.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A student as listed on a session detail view.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentSummaryDTO {

    private String id;

    private String name;

    private String email;
}
