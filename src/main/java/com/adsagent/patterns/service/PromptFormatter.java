package com.adsagent.patterns.service;

import com.adsagent.patterns.model.ColorPsychology;
import com.adsagent.patterns.model.EngagementTier;
import com.adsagent.patterns.model.HookPattern;
import com.adsagent.patterns.model.LayoutPattern;
import com.adsagent.patterns.model.LearnedPattern;
import com.adsagent.patterns.model.VisualElements;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders ranked patterns as a text block for the ad generation prompt. Only the user label and the
 * abstract pattern fields are rendered; ids, fingerprints and owner data never appear.
 */
@Service
public class PromptFormatter {

    static final String HEADER = "LEARNED SUCCESS PATTERNS FROM HIGH-PERFORMING ADS:\n"
            + "Use these proven patterns as inspiration for the ad design.";
    static final String FOOTER = "Apply these patterns to create an effective ad while keeping the content original.";

    /**
     * @return an empty string when there is nothing to render
     */
    public String format(List<LearnedPattern> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return "";
        }
        List<String> blocks = new ArrayList<>(patterns.size());
        for (int i = 0; i < patterns.size(); i++) {
            blocks.add(block(i + 1, patterns.get(i)));
        }
        return HEADER + "\n\n" + String.join("\n\n", blocks) + "\n\n" + FOOTER + "\n";
    }

    private String block(int number, LearnedPattern pattern) {
        List<String> lines = new ArrayList<>();
        lines.add("Pattern " + number + ": \"" + pattern.getName() + "\"");

        LayoutPattern layout = pattern.getLayoutPattern();
        if (layout != null) {
            String flow = layout.getVisualHierarchy() == null || layout.getVisualHierarchy().isEmpty()
                    ? "balanced"
                    : String.join(" -> ", layout.getVisualHierarchy());
            lines.add("  Layout: " + or(layout.getStructure(), "flexible") + " structure, "
                    + flow + " flow, "
                    + or(layout.getWhitespaceUsage(), "balanced") + " whitespace");
        }

        ColorPsychology color = pattern.getColorPsychology();
        if (color != null) {
            lines.add("  Color Mood: " + or(color.getDominantMood(), "neutral") + ", "
                    + or(color.getColorScheme(), "balanced") + " scheme, "
                    + or(color.getContrastLevel(), "medium") + " contrast");
        }

        HookPattern hook = pattern.getHookPattern();
        if (hook != null) {
            lines.add("  Hook: " + or(hook.getHookType(), "benefit") + " opening, "
                    + or(hook.getHeadlineFormula(), "direct") + " headline, "
                    + or(hook.getCtaStyle(), "direct") + " CTA");
        }

        VisualElements visuals = pattern.getVisualElements();
        if (visuals != null) {
            lines.add("  Visuals: " + or(visuals.getImageStyle(), "photography") + " style, "
                    + or(visuals.getProductVisibility(), "prominent") + " product focus, "
                    + (visuals.isHumanPresence() ? "with people" : "no people"));
        }

        EngagementTier tier = pattern.getEngagementTier();
        if (tier != null && tier.isVerified()) {
            lines.add("  Performance: " + tier.getValue().replace('-', ' ') + " percentile");
        }
        return String.join("\n", lines);
    }

    private static String or(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
