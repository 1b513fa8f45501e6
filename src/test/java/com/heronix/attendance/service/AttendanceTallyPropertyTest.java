package com.heronix.attendance.service;

import java.util.List;
import java.util.Map;
import java.util.Set;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

/**
 * Property-based tests for per-subject attendance counting.
 */
class AttendanceTallyPropertyTest {

    @Property(tries = 200)
    @Label("Attendance count never exceeds sessions held")
    void attendanceCount_neverExceedsTotalSessions(
            @ForAll("sessions") List<Set<String>> sessions) {

        AttendanceTally tally = new AttendanceTally();
        sessions.forEach(marked -> tally.addSession("Math", marked));

        Map<String, Integer> counts = tally.attendanceCounts("Math");
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            assert entry.getValue() >= 1 : "Listed students attended at least once";
            assert entry.getValue() <= tally.totalSessions("Math") : "Count bounded by sessions";
            double pct = tally.percentage("Math", entry.getKey());
            assert pct > 0.0 && pct <= 100.0 : "Percentage within (0, 100]";
        }
    }

    @Property(tries = 200)
    @Label("Total sessions equals sessions added, marked or not")
    void totalSessions_countsEverySession(
            @ForAll("sessions") List<Set<String>> sessions) {

        AttendanceTally tally = new AttendanceTally();
        sessions.forEach(marked -> tally.addSession("Math", marked));

        assert tally.totalSessions("Math") == sessions.size();
    }

    @Property(tries = 200)
    @Label("Order of sessions does not change the tally")
    void tally_isIndependentOfSessionOrder(
            @ForAll("sessions") List<Set<String>> sessions) {

        AttendanceTally forward = new AttendanceTally();
        sessions.forEach(marked -> forward.addSession("Math", marked));

        AttendanceTally backward = new AttendanceTally();
        for (int i = sessions.size() - 1; i >= 0; i--) {
            backward.addSession("Math", sessions.get(i));
        }

        assert forward.attendanceCounts("Math").equals(backward.attendanceCounts("Math"));
    }

    @Provide
    Arbitrary<List<Set<String>>> sessions() {
        Arbitrary<String> students = Arbitraries.of("A", "B", "C", "D", "E", "F");
        return students.set().ofMaxSize(6).list().ofMinSize(1).ofMaxSize(20);
    }
}
