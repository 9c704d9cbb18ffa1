package com.adsagent.patterns.service;

import com.adsagent.patterns.model.ColorPsychology;
import com.adsagent.patterns.model.HookPattern;
import com.adsagent.patterns.model.LayoutPattern;
import com.adsagent.patterns.model.RawPattern;
import com.adsagent.patterns.model.VisualElements;

import java.util.ArrayList;
import java.util.List;

/**
 * Canned model answers and patterns shared by the extraction tests.
 */
final class ExtractionFixtures {

    static final String VALID_RESPONSE = "{\n" +
            "  \"layoutPattern\": {\n" +
            "    \"structure\": \"hero-top\",\n" +
            "    \"visualHierarchy\": [\"product image\", \"headline\", \"cta button\"],\n" +
            "    \"whitespaceUsage\": \"generous\",\n" +
            "    \"focalPointPosition\": \"upper-third\"\n" +
            "  },\n" +
            "  \"colorPsychology\": {\n" +
            "    \"dominantMood\": \"trust\",\n" +
            "    \"colorScheme\": \"complementary\",\n" +
            "    \"contrastLevel\": \"high\",\n" +
            "    \"emotionalTone\": \"warm\"\n" +
            "  },\n" +
            "  \"hookPatterns\": {\n" +
            "    \"hookType\": \"benefit\",\n" +
            "    \"headlineFormula\": \"how-to\",\n" +
            "    \"ctaStyle\": \"direct\",\n" +
            "    \"persuasionTechnique\": \"social-proof\"\n" +
            "  },\n" +
            "  \"visualElements\": {\n" +
            "    \"imageStyle\": \"photography\",\n" +
            "    \"humanPresence\": false,\n" +
            "    \"productVisibility\": \"prominent\",\n" +
            "    \"iconography\": true,\n" +
            "    \"backgroundType\": \"gradient\"\n" +
            "  },\n" +
            "  \"confidenceScore\": 0.9\n" +
            "}";

    private ExtractionFixtures() {
    }

    static RawPattern cleanPattern() {
        return pattern(new ArrayList<>(List.of("product image", "headline", "cta button")), "trust", "how-to");
    }

    static RawPattern pattern(List<String> hierarchy, String dominantMood, String headlineFormula) {
        return new RawPattern(
                LayoutPattern.builder()
                        .structure("hero-top")
                        .visualHierarchy(hierarchy)
                        .whitespaceUsage("generous")
                        .focalPointPosition("upper-third")
                        .build(),
                ColorPsychology.builder()
                        .dominantMood(dominantMood)
                        .colorScheme("complementary")
                        .contrastLevel("high")
                        .emotionalTone("warm")
                        .build(),
                HookPattern.builder()
                        .hookType("benefit")
                        .headlineFormula(headlineFormula)
                        .ctaStyle("direct")
                        .persuasionTechnique("social-proof")
                        .build(),
                VisualElements.builder()
                        .imageStyle("photography")
                        .humanPresence(false)
                        .productVisibility("prominent")
                        .iconography(true)
                        .backgroundType("gradient")
                        .build(),
                0.9,
                List.of());
    }
}
