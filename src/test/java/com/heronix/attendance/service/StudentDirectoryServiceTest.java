package com.heronix.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.heronix.attendance.model.domain.StudentProfile;
import com.heronix.attendance.repository.StudentProfileRepository;
import com.heronix.attendance.security.CallerIdentity;

@ExtendWith(MockitoExtension.class)
class StudentDirectoryServiceTest {

    @Mock
    private StudentProfileRepository profileRepository;

    private StudentDirectoryService directory;

    private final CallerIdentity alice = CallerIdentity.student("s-alice", "Alice", "alice@school.edu");

    @BeforeEach
    void setUp() {
        directory = new StudentDirectoryService(profileRepository);
    }

    @Test
    void unchangedProfileIsNotRewritten() {
        when(profileRepository.findById("s-alice")).thenReturn(Optional.of(
                StudentProfile.builder().id("s-alice").name("Alice").email("alice@school.edu").build()));

        directory.remember(alice);

        verify(profileRepository, never()).save(any());
    }

    @Test
    void blankNameFallsBackToId() {
        when(profileRepository.findById("s-bob")).thenReturn(Optional.empty());

        directory.remember(CallerIdentity.student("s-bob", " ", null));

        verify(profileRepository).save(StudentProfile.builder().id("s-bob").name("s-bob").build());
    }

    @Test
    void concurrentFirstWriteIsTolerated() {
        when(profileRepository.findById("s-alice")).thenReturn(Optional.empty());
        when(profileRepository.save(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));
        when(profileRepository.existsById("s-alice")).thenReturn(true);

        directory.remember(alice);

        verify(profileRepository).existsById("s-alice");
    }

    @Test
    void rejectedWriteWithoutConcurrentProfilePropagates() {
        when(profileRepository.findById("s-alice")).thenReturn(Optional.empty());
        when(profileRepository.save(any())).thenThrow(new DataIntegrityViolationException("value too long"));
        when(profileRepository.existsById("s-alice")).thenReturn(false);

        assertThatThrownBy(() -> directory.remember(alice))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void lookupReturnsKnownProfilesOnly() {
        StudentProfile profile = StudentProfile.builder().id("s-alice").name("Alice").build();
        when(profileRepository.findAllById(Set.of("s-alice", "s-ghost"))).thenReturn(List.of(profile));

        assertThat(directory.lookup(Set.of("s-alice", "s-ghost"))).containsOnlyKeys("s-alice");
        assertThat(directory.lookup(Set.of())).isEmpty();
    }
}
