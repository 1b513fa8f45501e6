package com.heronix.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One student's line in a subject report.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentAttendanceDTO {

    private String name;

    private String email;

    /**
     * Sessions of the subject the student was marked in.
     */
    private int attendanceCount;

    /**
     * attendanceCount / totalSessions * 100, unrounded.
     */
    private double attendancePercentage;
}
