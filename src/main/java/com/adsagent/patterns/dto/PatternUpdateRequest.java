package com.adsagent.patterns.dto;

import com.adsagent.patterns.model.EngagementTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of the user-editable labels of a pattern. Extracted fields and the
 * source fingerprint cannot be changed. {@code null} means "leave as is".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternUpdateRequest {
    private String name;
    private String category;
    private String platform;
    private String industry;
    private EngagementTier engagementTier;
    private Boolean active;
}
