package com.adsagent.patterns.model;

import java.util.List;

/**
 * Pattern fields as produced by extraction (and later sanitization), before owner metadata is attached.
 *
 * @param confidenceScore always within [0, 1]
 * @param flags           notes about clamps, defaults, off-vocabulary values and redactions
 */
public record RawPattern(
        LayoutPattern layoutPattern,
        ColorPsychology colorPsychology,
        HookPattern hookPattern,
        VisualElements visualElements,
        double confidenceScore,
        List<String> flags
) {
    public RawPattern {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public boolean isFlagged() {
        return !flags.isEmpty();
    }
}
