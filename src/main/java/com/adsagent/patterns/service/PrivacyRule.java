package com.adsagent.patterns.service;

import com.adsagent.patterns.model.PrivacySignals;

import java.util.List;
import java.util.Optional;

/**
 * One rejection criterion evaluated against the model's privacy signals.
 * Register additional rules as beans; they run after the built-in ones.
 */
@FunctionalInterface
public interface PrivacyRule {

    /**
     * @param signals        raw findings for the image
     * @param detectedBrands blocklisted brands found in the image text
     * @return a rejection reason, or empty when the rule passes
     */
    Optional<String> evaluate(PrivacySignals signals, List<String> detectedBrands);
}
