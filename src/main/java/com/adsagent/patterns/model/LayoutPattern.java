package com.adsagent.patterns.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract composition of an ad: structure, attention flow, whitespace and focal point.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LayoutPattern {
    private String structure;
    @Builder.Default
    private List<String> visualHierarchy = new ArrayList<>();   // at most 3 abstract labels, first = strongest
    private String whitespaceUsage;
    private String focalPointPosition;
}
