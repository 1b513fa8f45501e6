package com.heronix.attendance.service;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.heronix.attendance.model.domain.StudentProfile;
import com.heronix.attendance.repository.StudentProfileRepository;
import com.heronix.attendance.security.CallerIdentity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the name and email of students as presented by the identity layer,
 * so reports can label the opaque ids stored on sessions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudentDirectoryService {

    private final StudentProfileRepository profileRepository;

    /**
     * Store or refresh the profile of a student principal. Writes only on change.
     */
    public void remember(CallerIdentity student) {
        String name = student.name() == null || student.name().isBlank() ? student.id() : student.name();

        Optional<StudentProfile> existing = profileRepository.findById(student.id());
        if (existing.isPresent()
                && existing.get().getName().equals(name)
                && Objects.equals(existing.get().getEmail(), student.email())) {
            return;
        }

        StudentProfile profile = existing.orElseGet(() -> StudentProfile.builder().id(student.id()).build());
        profile.setName(name);
        profile.setEmail(student.email());

        try {
            profileRepository.save(profile);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            if (!profileRepository.existsById(student.id())) {
                throw e;
            }
            // first scans of the same student racing; the other insert carries the same principal data
            log.debug("Profile for student {} written concurrently: {}", student.id(), e.getMessage());
        }
    }

    /**
     * Profiles for the given ids. Unknown ids are missing from the result.
     */
    public Map<String, StudentProfile> lookup(Collection<String> studentIds) {
        if (studentIds.isEmpty()) {
            return Map.of();
        }
        return profileRepository.findAllById(studentIds).stream()
                .collect(Collectors.toMap(StudentProfile::getId, Function.identity()));
    }
}
