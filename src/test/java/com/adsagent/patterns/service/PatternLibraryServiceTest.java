package com.adsagent.patterns.service;

import com.adsagent.patterns.dto.PatternFilter;
import com.adsagent.patterns.dto.PatternUpdateRequest;
import com.adsagent.patterns.model.EngagementTier;
import com.adsagent.patterns.model.LayoutPattern;
import com.adsagent.patterns.model.LearnedPattern;
import com.adsagent.patterns.repository.InMemoryPatternRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternLibraryServiceTest {

    private InMemoryPatternRepository repository;
    private PatternLibraryService service;
    private LearnedPattern stored;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPatternRepository();
        service = new PatternLibraryService(repository);
        LearnedPattern pattern = new LearnedPattern();
        pattern.setOwnerId("owner-1");
        pattern.setName("Original");
        pattern.setCategory("testimonial");
        pattern.setPlatform("instagram");
        pattern.setSourceHash("hash-1");
        pattern.setLayoutPattern(LayoutPattern.builder().structure("grid").build());
        stored = repository.seed(pattern);
    }

    @Test
    void updateChangesOnlyEditableLabels() {
        LearnedPattern updated = service.update("owner-1", stored.getId(), PatternUpdateRequest.builder()
                .name("  Renamed  ")
                .platform("linkedin")
                .engagementTier(EngagementTier.TOP_10)
                .build());

        assertThat(updated.getName()).isEqualTo("Renamed");
        assertThat(updated.getPlatform()).isEqualTo("linkedin");
        assertThat(updated.getCategory()).isEqualTo("testimonial");
        assertThat(updated.getEngagementTier()).isEqualTo(EngagementTier.TOP_10);
        assertThat(updated.getSourceHash()).isEqualTo("hash-1");
        assertThat(updated.getLayoutPattern().getStructure()).isEqualTo("grid");
    }

    @Test
    void blankNameIsRejected() {
        PatternUpdateRequest request = PatternUpdateRequest.builder().name("   ").build();

        assertThatThrownBy(() -> service.update("owner-1", stored.getId(), request))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deactivatedPatternsDropOutOfActiveList() {
        service.deactivate("owner-1", stored.getId());

        assertThat(repository.listActive("owner-1")).isEmpty();
        assertThat(service.list("owner-1", new PatternFilter(null, null, null, false))).containsExactly(stored);
    }

    @Test
    void otherOwnersCannotTouchPattern() {
        assertThat(service.findById("owner-2", stored.getId())).isEmpty();
        assertThatThrownBy(() -> service.deactivate("owner-2", stored.getId()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(service.delete("owner-2", stored.getId())).isFalse();
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void deleteRemovesPattern() {
        assertThat(service.delete("owner-1", stored.getId())).isTrue();
        assertThat(service.findById("owner-1", stored.getId())).isEmpty();
        assertThat(service.delete("owner-1", UUID.randomUUID())).isFalse();
    }
}
