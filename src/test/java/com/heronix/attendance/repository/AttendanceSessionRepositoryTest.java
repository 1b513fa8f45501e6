package com.heronix.attendance.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import com.heronix.attendance.model.domain.AttendanceSession;
import com.heronix.attendance.model.enums.SessionStatus;

@DataJpaTest
class AttendanceSessionRepositoryTest {

    private static final LocalDateTime OPENED = LocalDateTime.of(2025, 9, 1, 8, 0);

    @Autowired
    private AttendanceSessionRepository sessionRepository;

    @Test
    void conditionalInsertAddsStudentOnce() {
        AttendanceSession session = save("ATT_ONE_AA", "Math", OPENED.plusMinutes(1));

        assertThat(sessionRepository.insertMarkIfOpen(session.getId(), "s1", OPENED.plusSeconds(10))).isEqualTo(1);
        assertThat(sessionRepository.insertMarkIfOpen(session.getId(), "s1", OPENED.plusSeconds(20))).isZero();

        AttendanceSession reloaded = sessionRepository.findById(session.getId()).orElseThrow();
        assertThat(reloaded.getMarkedStudents()).containsExactly("s1");
    }

    @Test
    void conditionalInsertRefusesElapsedWindow() {
        AttendanceSession session = save("ATT_TWO_AA", "Math", OPENED.plusMinutes(1));

        assertThat(sessionRepository.insertMarkIfOpen(session.getId(), "s1", OPENED.plusMinutes(1))).isZero();
        assertThat(sessionRepository.insertMarkIfOpen(session.getId(), "s2", OPENED.plusMinutes(2))).isZero();
        assertThat(sessionRepository.findById(session.getId()).orElseThrow().getMarkedStudents()).isEmpty();
    }

    @Test
    void conditionalInsertRefusesExpiredSession() {
        AttendanceSession session = save("ATT_THREE_AA", "Math", OPENED.plusMinutes(10));
        sessionRepository.expireIfActive(session.getId(), OPENED.plusSeconds(5), true,
                SessionStatus.ACTIVE, SessionStatus.EXPIRED);

        assertThat(sessionRepository.insertMarkIfOpen(session.getId(), "s1", OPENED.plusSeconds(10))).isZero();
    }

    @Test
    void expireIfActiveTransitionsOnlyOnce() {
        AttendanceSession session = save("ATT_FOUR_AA", "Math", OPENED.plusMinutes(10));

        assertThat(sessionRepository.expireIfActive(session.getId(), OPENED.plusMinutes(1), true,
                SessionStatus.ACTIVE, SessionStatus.EXPIRED)).isEqualTo(1);
        assertThat(sessionRepository.expireIfActive(session.getId(), OPENED.plusMinutes(2), false,
                SessionStatus.ACTIVE, SessionStatus.EXPIRED)).isZero();

        AttendanceSession reloaded = sessionRepository.findById(session.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(SessionStatus.EXPIRED);
        assertThat(reloaded.getExpiredAt()).isEqualTo(OPENED.plusMinutes(1));
        assertThat(reloaded.isClosedEarly()).isTrue();
    }

    @Test
    void expireElapsedLeavesOpenWindowsAlone() {
        AttendanceSession elapsed = save("ATT_FIVE_AA", "Math", OPENED.plusMinutes(1));
        AttendanceSession open = save("ATT_SIX_AA", "Math", OPENED.plusMinutes(30));

        assertThat(sessionRepository.expireElapsed(OPENED.plusMinutes(5),
                SessionStatus.ACTIVE, SessionStatus.EXPIRED)).isEqualTo(1);

        assertThat(sessionRepository.findById(elapsed.getId()).orElseThrow().getStatus())
                .isEqualTo(SessionStatus.EXPIRED);
        assertThat(sessionRepository.findById(open.getId()).orElseThrow().getStatus())
                .isEqualTo(SessionStatus.ACTIVE);
        assertThat(sessionRepository.countByStatus(SessionStatus.ACTIVE)).isEqualTo(1);
    }

    @Test
    void findsAttendedSessionsAndCountsSubjects() {
        AttendanceSession math1 = save("ATT_M1_AA", "Math", OPENED.plusMinutes(30));
        AttendanceSession math2 = save("ATT_M2_AA", "Math", OPENED.plusMinutes(30));
        AttendanceSession physics = save("ATT_P1_AA", "Physics", OPENED.plusMinutes(30));
        sessionRepository.insertMarkIfOpen(math1.getId(), "s1", OPENED.plusSeconds(5));
        sessionRepository.insertMarkIfOpen(physics.getId(), "s1", OPENED.plusSeconds(5));
        sessionRepository.insertMarkIfOpen(math2.getId(), "s2", OPENED.plusSeconds(5));

        List<AttendanceSession> attended = sessionRepository.findAttendedBy("s1");

        assertThat(attended).extracting(AttendanceSession::getCode)
                .containsExactlyInAnyOrder("ATT_M1_AA", "ATT_P1_AA");
        assertThat(sessionRepository.countBySubject("Math")).isEqualTo(2);
        assertThat(sessionRepository.findByCode("ATT_M2_AA")).isPresent();
        assertThat(sessionRepository.existsByCode("ATT_NONE_AA")).isFalse();
    }

    @Test
    void duplicateCodeIsRejectedByStore() {
        save("ATT_DUP_AA", "Math", OPENED.plusMinutes(1));

        assertThatThrownBy(() -> save("ATT_DUP_AA", "Physics", OPENED.plusMinutes(1)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private AttendanceSession save(String code, String subject, LocalDateTime expiresAt) {
        return sessionRepository.saveAndFlush(AttendanceSession.builder()
                .ownerId("prof-1")
                .subject(subject)
                .classroom("B-204")
                .code(code)
                .status(SessionStatus.ACTIVE)
                .createdAt(OPENED)
                .expiresAt(expiresAt)
                .build());
    }
}
