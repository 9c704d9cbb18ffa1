package com.adsagent.patterns.service;

import com.adsagent.patterns.model.PatternApplication;
import com.adsagent.patterns.repository.PatternApplicationRepository;
import com.adsagent.patterns.repository.PatternRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PatternUsageServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private PatternRepository patternRepository;

    @Mock
    private PatternApplicationRepository applicationRepository;

    private PatternUsageService service;

    @BeforeEach
    void setUp() {
        service = new PatternUsageService(patternRepository, applicationRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void recordingAnApplicationTouchesUsageAndWritesHistory() {
        UUID patternId = UUID.randomUUID();
        when(applicationRepository.save(any(PatternApplication.class))).thenAnswer(inv -> inv.getArgument(0));

        PatternApplication application = service.recordApplication("owner-1", patternId, "instagram");

        verify(patternRepository).touchUsage("owner-1", patternId);
        assertThat(application.getOwnerId()).isEqualTo("owner-1");
        assertThat(application.getPatternId()).isEqualTo(patternId);
        assertThat(application.getTargetPlatform()).isEqualTo("instagram");
        assertThat(application.getCreatedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void foreignPatternIsNotRecorded() {
        UUID patternId = UUID.randomUUID();
        doThrow(new IllegalArgumentException("not yours")).when(patternRepository).touchUsage("owner-2", patternId);

        assertThatThrownBy(() -> service.recordApplication("owner-2", patternId, "instagram"))
                .isInstanceOf(IllegalArgumentException.class);
        verify(applicationRepository, never()).save(any());
    }

    @Test
    void ratingIsStored() {
        UUID applicationId = UUID.randomUUID();
        PatternApplication application = new PatternApplication();
        when(applicationRepository.findByIdAndOwnerId(applicationId, "owner-1")).thenReturn(Optional.of(application));
        when(applicationRepository.save(application)).thenReturn(application);

        PatternApplication rated = service.rate("owner-1", applicationId, 4, true, "  worked well ");

        assertThat(rated.getUserRating()).isEqualTo(4);
        assertThat(rated.isWasUsed()).isTrue();
        assertThat(rated.getFeedback()).isEqualTo("worked well");
    }

    @Test
    void ratingOutsideOneToFiveIsRejected() {
        assertThatThrownBy(() -> service.rate("owner-1", UUID.randomUUID(), 0, false, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.rate("owner-1", UUID.randomUUID(), 6, false, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
