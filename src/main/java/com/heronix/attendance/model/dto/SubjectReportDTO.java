package com.heronix.attendance.model.dto;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attendance statistics for one subject of one instructor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubjectReportDTO {

    /**
     * Sessions held for the subject, including ones nobody scanned.
     */
    private int totalSessions;

    /**
     * Keyed by student id. Students who never attended are not listed.
     */
    private Map<String, StudentAttendanceDTO> students;
}
