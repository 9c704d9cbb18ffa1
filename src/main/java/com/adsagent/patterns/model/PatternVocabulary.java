package com.adsagent.patterns.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed vocabularies for every enumerated pattern field, in the order the extraction prompt lists them.
 * Each field carries a neutral default used when a value has to be coerced.
 */
public enum PatternVocabulary {

    STRUCTURE("structure", "minimal-centered",
            List.of("hero-top", "hero-left", "hero-right", "split-50-50", "text-overlay", "grid", "full-bleed", "minimal-centered")),
    WHITESPACE_USAGE("whitespaceUsage", "balanced",
            List.of("minimal", "balanced", "generous")),
    FOCAL_POINT_POSITION("focalPointPosition", "center",
            List.of("center", "upper-third", "lower-third", "left-third", "right-third", "golden-ratio")),
    DOMINANT_MOOD("dominantMood", "professional",
            List.of("trust", "excitement", "calm", "urgency", "luxury", "friendly", "professional")),
    COLOR_SCHEME("colorScheme", "complementary",
            List.of("monochromatic", "complementary", "analogous", "triadic")),
    CONTRAST_LEVEL("contrastLevel", "medium",
            List.of("low", "medium", "high")),
    EMOTIONAL_TONE("emotionalTone", "subtle",
            List.of("energetic", "serene", "bold", "subtle", "warm", "cool")),
    HOOK_TYPE("hookType", "benefit",
            List.of("question", "statistic", "pain-point", "benefit", "curiosity", "fear", "aspiration", "social-proof")),
    HEADLINE_FORMULA("headlineFormula", "problem-solution",
            List.of("how-to", "number-list", "problem-solution", "before-after", "testimonial-style", "command", "comparison")),
    CTA_STYLE("ctaStyle", "direct",
            List.of("soft", "direct", "urgency")),
    PERSUASION_TECHNIQUE("persuasionTechnique", "social-proof",
            List.of("scarcity", "authority", "social-proof", "reciprocity", "commitment", "liking")),
    IMAGE_STYLE("imageStyle", "mixed",
            List.of("photography", "illustration", "mixed", "3d-render", "abstract")),
    PRODUCT_VISIBILITY("productVisibility", "subtle",
            List.of("prominent", "subtle", "none")),
    BACKGROUND_TYPE("backgroundType", "solid",
            List.of("solid", "gradient", "image", "pattern"));

    private final String fieldName;
    private final String defaultValue;
    private final List<String> values;

    PatternVocabulary(String fieldName, String defaultValue, List<String> values) {
        this.fieldName = fieldName;
        this.defaultValue = defaultValue;
        this.values = values;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public List<String> getValues() {
        return values;
    }

    /**
     * Returns the canonical vocabulary term when {@code raw} matches one, ignoring case and surrounding space.
     */
    public Optional<String> canonical(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        return values.stream().filter(normalized::equals).findFirst();
    }

    public boolean contains(String raw) {
        return canonical(raw).isPresent();
    }

    /**
     * Maps an arbitrary value onto the vocabulary: an exact match, else the first term mentioned
     * inside the value, else the neutral default.
     */
    public String nearest(String raw) {
        Optional<String> exact = canonical(raw);
        if (exact.isPresent()) {
            return exact.get();
        }
        if (raw != null) {
            String lower = raw.toLowerCase(Locale.ROOT);
            for (String value : values) {
                if (lower.contains(value) || lower.contains(value.replace('-', ' '))) {
                    return value;
                }
            }
        }
        return defaultValue;
    }
}
