package com.adsagent.patterns.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HookPattern {
    private String hookType;
    private String headlineFormula;
    private String ctaStyle;
    private String persuasionTechnique;
}
