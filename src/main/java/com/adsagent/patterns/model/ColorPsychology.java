package com.adsagent.patterns.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ColorPsychology {
    private String dominantMood;
    private String colorScheme;
    private String contrastLevel;
    private String emotionalTone;
}
