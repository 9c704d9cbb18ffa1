package com.adsagent.patterns.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VisualElements {
    private String imageStyle;
    private boolean humanPresence;
    private String productVisibility;
    private boolean iconography;
    private String backgroundType;
}
