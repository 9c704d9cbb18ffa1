package com.adsagent.patterns.service;

import java.util.Optional;

/**
 * Helpers for pulling a JSON object out of free-form model text.
 */
final class ModelResponses {

    static final int EXCERPT_LENGTH = 500;

    private ModelResponses() {
    }

    /**
     * Returns the span from the first '{' to the last '}', after dropping markdown fences.
     */
    static Optional<String> extractJsonObject(String responseText) {
        if (responseText == null) {
            return Optional.empty();
        }
        String text = responseText.trim();
        if (text.startsWith("```json")) {
            text = text.substring(7).trim();
        } else if (text.startsWith("```")) {
            text = text.substring(3).trim();
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3).trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }

    static String excerpt(String responseText) {
        if (responseText == null) {
            return "";
        }
        return responseText.length() <= EXCERPT_LENGTH ? responseText : responseText.substring(0, EXCERPT_LENGTH);
    }
}
