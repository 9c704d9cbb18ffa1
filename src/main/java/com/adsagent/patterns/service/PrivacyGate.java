package com.adsagent.patterns.service;

import com.adsagent.patterns.model.PrivacyScanResult;

/**
 * Decides whether an image may be sent on to pattern extraction. Never stores the image or any text read from it.
 * Backed by a model, so two scans of identical bytes are not guaranteed to agree.
 */
public interface PrivacyGate {

    PrivacyScanResult scan(byte[] imageBytes, String mimeType);
}
