package com.heronix.attendance.service;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Counts sessions and per-student attendance for a set of sessions, grouped by subject.
 *
 * Not thread-safe; build one per report.
 */
public class AttendanceTally {

    private final Map<String, Integer> sessionsBySubject = new TreeMap<>();
    private final Map<String, Map<String, Integer>> attendanceBySubject = new HashMap<>();

    /**
     * Count one session of {@code subject} with the given marked students.
     * Sessions without marks still count.
     */
    public void addSession(String subject, Collection<String> markedStudents) {
        sessionsBySubject.merge(subject, 1, Integer::sum);
        Map<String, Integer> counts = attendanceBySubject.computeIfAbsent(subject, k -> new HashMap<>());
        for (String studentId : markedStudents) {
            counts.merge(studentId, 1, Integer::sum);
        }
    }

    /**
     * Subjects seen, in alphabetical order.
     */
    public Set<String> subjects() {
        return Collections.unmodifiableSet(sessionsBySubject.keySet());
    }

    public int totalSessions(String subject) {
        return sessionsBySubject.getOrDefault(subject, 0);
    }

    /**
     * Sessions attended per student. Students never marked are absent.
     */
    public Map<String, Integer> attendanceCounts(String subject) {
        return Collections.unmodifiableMap(attendanceBySubject.getOrDefault(subject, Map.of()));
    }

    public double percentage(String subject, String studentId) {
        return percentage(attendanceCounts(subject).getOrDefault(studentId, 0), totalSessions(subject));
    }

    /**
     * count / total * 100 as a double. Zero when there are no sessions.
     */
    public static double percentage(long count, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return (double) count / total * 100.0;
    }
}
