package com.adsagent.patterns.service;

/**
 * Vision-capable structured extraction capability. Responses are untrusted and not deterministic:
 * the same image may yield different answers between calls.
 */
public interface VisionModelClient {

    /**
     * Sends the instructions and image and returns the model's text answer.
     *
     * @throws ModelTransportException when the provider is unreachable, times out repeatedly or rejects the call
     */
    String analyzeImage(VisionRequest request);
}
