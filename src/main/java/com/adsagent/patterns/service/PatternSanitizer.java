package com.adsagent.patterns.service;

import com.adsagent.patterns.model.ColorPsychology;
import com.adsagent.patterns.model.HookPattern;
import com.adsagent.patterns.model.LayoutPattern;
import com.adsagent.patterns.model.PatternVocabulary;
import com.adsagent.patterns.model.RawPattern;
import com.adsagent.patterns.model.VisualElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-free second pass over an extracted pattern. Strips URLs, contact details, prices,
 * percentages, digit runs and blocklisted brand names from every string field, and replaces
 * anything that still reads like ad copy. Works the same whatever the extraction step returned.
 */
@Service
public class PatternSanitizer {

    private static final Logger logger = LoggerFactory.getLogger(PatternSanitizer.class);

    public static final String PLACEHOLDER = "[redacted]";
    public static final String AD_COPY_PLACEHOLDER = "[content redacted - pattern only]";

    // Applied in order; URLs before domains so a full link collapses into one placeholder
    private static final List<Pattern> LITERALS = List.of(
            ContactPatterns.URL,
            ContactPatterns.EMAIL,
            ContactPatterns.DOMAIN,
            ContactPatterns.PRICE,
            ContactPatterns.PERCENT,
            ContactPatterns.PHONE,
            ContactPatterns.DIGIT_RUN
    );

    private static final Pattern NUMERIC_CLAIM = Pattern.compile("\\$\\d+|\\d+%");
    private static final List<Pattern> AD_COPY_MARKERS = List.of(
            Pattern.compile("\"[^\"]+\""),
            Pattern.compile("!"),
            Pattern.compile("[A-Z]{2,}(?:\\s[A-Z]{2,})+")
    );

    public RawPattern sanitize(RawPattern pattern) {
        Set<String> touched = new LinkedHashSet<>();

        LayoutPattern layout = pattern.layoutPattern() == null ? null : pattern.layoutPattern().toBuilder()
                .structure(enumerated(pattern.layoutPattern().getStructure(), PatternVocabulary.STRUCTURE, touched))
                .visualHierarchy(hierarchy(pattern.layoutPattern().getVisualHierarchy(), touched))
                .whitespaceUsage(enumerated(pattern.layoutPattern().getWhitespaceUsage(), PatternVocabulary.WHITESPACE_USAGE, touched))
                .focalPointPosition(enumerated(pattern.layoutPattern().getFocalPointPosition(), PatternVocabulary.FOCAL_POINT_POSITION, touched))
                .build();

        ColorPsychology color = pattern.colorPsychology() == null ? null : pattern.colorPsychology().toBuilder()
                .dominantMood(enumerated(pattern.colorPsychology().getDominantMood(), PatternVocabulary.DOMINANT_MOOD, touched))
                .colorScheme(enumerated(pattern.colorPsychology().getColorScheme(), PatternVocabulary.COLOR_SCHEME, touched))
                .contrastLevel(enumerated(pattern.colorPsychology().getContrastLevel(), PatternVocabulary.CONTRAST_LEVEL, touched))
                .emotionalTone(enumerated(pattern.colorPsychology().getEmotionalTone(), PatternVocabulary.EMOTIONAL_TONE, touched))
                .build();

        HookPattern hook = pattern.hookPattern() == null ? null : pattern.hookPattern().toBuilder()
                .hookType(enumerated(pattern.hookPattern().getHookType(), PatternVocabulary.HOOK_TYPE, touched))
                .headlineFormula(enumerated(pattern.hookPattern().getHeadlineFormula(), PatternVocabulary.HEADLINE_FORMULA, touched))
                .ctaStyle(enumerated(pattern.hookPattern().getCtaStyle(), PatternVocabulary.CTA_STYLE, touched))
                .persuasionTechnique(enumerated(pattern.hookPattern().getPersuasionTechnique(), PatternVocabulary.PERSUASION_TECHNIQUE, touched))
                .build();

        VisualElements visuals = pattern.visualElements() == null ? null : pattern.visualElements().toBuilder()
                .imageStyle(enumerated(pattern.visualElements().getImageStyle(), PatternVocabulary.IMAGE_STYLE, touched))
                .productVisibility(enumerated(pattern.visualElements().getProductVisibility(), PatternVocabulary.PRODUCT_VISIBILITY, touched))
                .backgroundType(enumerated(pattern.visualElements().getBackgroundType(), PatternVocabulary.BACKGROUND_TYPE, touched))
                .build();

        if (touched.isEmpty()) {
            return pattern;
        }

        logger.warn("Sanitizer altered fields {}", touched);
        List<String> flags = new ArrayList<>(pattern.flags());
        touched.forEach(field -> flags.add("sanitized:" + field));
        double confidence = Math.min(pattern.confidenceScore(), PatternExtractor.FLAGGED_CONFIDENCE_CAP);
        return new RawPattern(layout, color, hook, visuals, confidence, flags);
    }

    /**
     * Removes literal content from free text, leaving the abstract description around it.
     */
    String scrub(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern literal : LITERALS) {
            result = literal.matcher(result).replaceAll(Matcher.quoteReplacement(PLACEHOLDER));
        }
        return BrandBlocklist.redact(result, PLACEHOLDER);
    }

    boolean isLikelyAdCopy(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (NUMERIC_CLAIM.matcher(text).find()) {
            return true;
        }
        return AD_COPY_MARKERS.stream().anyMatch(p -> p.matcher(text).find());
    }

    // Vocabulary terms are known to be safe and are never rewritten
    private String enumerated(String value, PatternVocabulary vocabulary, Set<String> touched) {
        if (value == null || vocabulary.contains(value)) {
            return value;
        }
        String scrubbed = scrub(value);
        if (scrubbed.equals(value) && !isLikelyAdCopy(value)) {
            return value;
        }
        touched.add(vocabulary.getFieldName());
        return vocabulary.nearest(scrubbed);
    }

    private List<String> hierarchy(List<String> entries, Set<String> touched) {
        List<String> cleaned = new ArrayList<>();
        if (entries == null) {
            return cleaned;
        }
        boolean changed = false;
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                changed = true;
                continue;
            }
            String value = isLikelyAdCopy(entry) ? AD_COPY_PLACEHOLDER : scrub(entry);
            changed |= !value.equals(entry);
            cleaned.add(value);
        }
        if (changed) {
            touched.add("visualHierarchy");
        }
        return cleaned;
    }
}
