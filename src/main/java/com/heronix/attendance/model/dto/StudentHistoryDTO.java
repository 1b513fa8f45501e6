package com.heronix.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A student's own attendance for one subject.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentHistoryDTO {

    private int attended;

    private long totalClasses;

    private double attendancePercentage;
}
