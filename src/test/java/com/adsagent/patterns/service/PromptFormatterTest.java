package com.adsagent.patterns.service;

import com.adsagent.patterns.model.ColorPsychology;
import com.adsagent.patterns.model.EngagementTier;
import com.adsagent.patterns.model.HookPattern;
import com.adsagent.patterns.model.LayoutPattern;
import com.adsagent.patterns.model.LearnedPattern;
import com.adsagent.patterns.model.VisualElements;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PromptFormatterTest {

    private final PromptFormatter formatter = new PromptFormatter();

    @Test
    void emptyInputRendersNothing() {
        assertThat(formatter.format(List.of())).isEmpty();
        assertThat(formatter.format(null)).isEmpty();
    }

    @Test
    void rendersNumberedBlocksBetweenHeaderAndFooter() {
        LearnedPattern first = fullPattern("Clean hero", EngagementTier.TOP_5);
        LearnedPattern second = new LearnedPattern();
        second.setName("Bare");
        second.setEngagementTier(EngagementTier.UNVERIFIED);

        String text = formatter.format(List.of(first, second));

        assertThat(text).isEqualTo(PromptFormatter.HEADER + "\n\n"
                + "Pattern 1: \"Clean hero\"\n"
                + "  Layout: hero-top structure, product image -> headline flow, generous whitespace\n"
                + "  Color Mood: trust, complementary scheme, high contrast\n"
                + "  Hook: benefit opening, how-to headline, direct CTA\n"
                + "  Visuals: photography style, prominent product focus, with people\n"
                + "  Performance: top 5 percentile\n\n"
                + "Pattern 2: \"Bare\"\n\n"
                + PromptFormatter.FOOTER + "\n");
    }

    @Test
    void missingValuesFallBackToNeutralWords() {
        LearnedPattern pattern = new LearnedPattern();
        pattern.setName("Sparse");
        pattern.setLayoutPattern(new LayoutPattern());
        pattern.setColorPsychology(new ColorPsychology());
        pattern.setHookPattern(new HookPattern());
        pattern.setVisualElements(new VisualElements());

        assertThat(formatter.format(List.of(pattern)))
                .contains("  Layout: flexible structure, balanced flow, balanced whitespace")
                .contains("  Color Mood: neutral, balanced scheme, medium contrast")
                .contains("  Hook: benefit opening, direct headline, direct CTA")
                .contains("  Visuals: photography style, prominent product focus, no people")
                .doesNotContain("Performance");
    }

    @Test
    void neverRendersIdentifiers() {
        LearnedPattern pattern = fullPattern("Labelled", EngagementTier.TOP_1);
        pattern.setId(UUID.randomUUID());
        pattern.setSourceHash("abc123def456");
        pattern.setOwnerId("owner-secret");

        String text = formatter.format(List.of(pattern));

        assertThat(text)
                .doesNotContain(pattern.getId().toString())
                .doesNotContain("abc123def456")
                .doesNotContain("owner-secret");
    }

    @Test
    void outputIsDeterministic() {
        List<LearnedPattern> patterns = List.of(fullPattern("One", EngagementTier.TOP_10), fullPattern("Two", null));

        assertThat(formatter.format(patterns)).isEqualTo(formatter.format(patterns));
    }

    private static LearnedPattern fullPattern(String name, EngagementTier tier) {
        LearnedPattern pattern = new LearnedPattern();
        pattern.setName(name);
        pattern.setEngagementTier(tier);
        pattern.setLayoutPattern(LayoutPattern.builder()
                .structure("hero-top")
                .visualHierarchy(List.of("product image", "headline"))
                .whitespaceUsage("generous")
                .focalPointPosition("center")
                .build());
        pattern.setColorPsychology(ColorPsychology.builder()
                .dominantMood("trust").colorScheme("complementary").contrastLevel("high").emotionalTone("warm").build());
        pattern.setHookPattern(HookPattern.builder()
                .hookType("benefit").headlineFormula("how-to").ctaStyle("direct").persuasionTechnique("authority").build());
        pattern.setVisualElements(VisualElements.builder()
                .imageStyle("photography").humanPresence(true).productVisibility("prominent").iconography(false)
                .backgroundType("solid").build());
        return pattern;
    }
}
