package com.adsagent.patterns.service;

import com.adsagent.patterns.model.PrivacyScanResult;
import com.adsagent.patterns.model.PrivacySignals;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Privacy gate backed by the vision model. The model only reports signals (faces, logos, text,
 * contact details); the accept/reject decision is made here by ordered, model-free rules.
 * Any failure to obtain or parse the signals fails closed.
 */
@Service
public class VisionPrivacyGate implements PrivacyGate {

    private static final Logger logger = LoggerFactory.getLogger(VisionPrivacyGate.class);

    static final String SCAN_FAILED_REASON = "Privacy scan failed - cannot verify image safety";
    static final String UNREADABLE_REASON = "Could not analyze image for privacy concerns";

    private static final String SCAN_PROMPT =
            "Analyze this image for privacy concerns. Return a JSON object ONLY (no markdown, no commentary) with:\n" +
                    "\n" +
                    "{\n" +
                    "  \"textDensity\": <number 0-100, percentage of image covered by readable text>,\n" +
                    "  \"detectedText\": <array of all readable text strings found, or empty array if none>,\n" +
                    "  \"hasLogos\": <boolean, true if any company/brand logos are visible>,\n" +
                    "  \"logoDescriptions\": <array of generic logo descriptions like \"circular tech logo\">,\n" +
                    "  \"hasFaces\": <boolean, true if any human faces are visible>,\n" +
                    "  \"faceCount\": <number of faces detected>,\n" +
                    "  \"hasContactInfo\": <boolean, true if emails, phone numbers, or websites are visible>\n" +
                    "}\n" +
                    "\n" +
                    "Be thorough - detect ALL text, logos, and faces. This is for privacy compliance.\n" +
                    "Do NOT describe the ad content or products - ONLY report privacy-relevant elements.";

    private final VisionModelClient visionModelClient;
    private final ObjectMapper objectMapper;
    private final String modelId;
    private final double maxTextDensity;
    private final List<PrivacyRule> rules;

    @Autowired
    public VisionPrivacyGate(VisionModelClient visionModelClient,
                             ObjectMapper objectMapper,
                             @Value("${aws.bedrock.privacyModelId:${aws.bedrock.visionModelId}}") String modelId,
                             @Value("${app.privacy.maxTextDensity:15}") double maxTextDensity,
                             ObjectProvider<PrivacyRule> additionalRules) {
        this(visionModelClient, objectMapper, modelId, maxTextDensity, additionalRules.orderedStream().toList());
    }

    VisionPrivacyGate(VisionModelClient visionModelClient,
                      ObjectMapper objectMapper,
                      String modelId,
                      double maxTextDensity,
                      List<PrivacyRule> additionalRules) {
        this.visionModelClient = visionModelClient;
        this.objectMapper = objectMapper;
        this.modelId = modelId;
        this.maxTextDensity = maxTextDensity;
        List<PrivacyRule> ordered = new ArrayList<>(builtInRules());
        ordered.addAll(additionalRules);
        this.rules = List.copyOf(ordered);
        logger.info("VisionPrivacyGate initialized with model {} and {} rules", modelId, rules.size());
    }

    @Override
    public PrivacyScanResult scan(byte[] imageBytes, String mimeType) {
        String responseText;
        try {
            responseText = visionModelClient.analyzeImage(
                    new VisionRequest("privacy_scan", modelId, SCAN_PROMPT, imageBytes, mimeType, 0.1));
        } catch (ModelTransportException e) {
            logger.error("Privacy scan could not reach the model: {}", e.getMessage());
            return audit(PrivacyScanResult.unverified(SCAN_FAILED_REASON));
        }

        Optional<PrivacySignals> signals = parseSignals(responseText);
        if (signals.isEmpty()) {
            logger.warn("Failed to parse privacy scan response: {}", ModelResponses.excerpt(responseText));
            return audit(PrivacyScanResult.unverified(UNREADABLE_REASON));
        }
        return audit(evaluate(signals.get()));
    }

    PrivacyScanResult evaluate(PrivacySignals signals) {
        Set<String> brands = new LinkedHashSet<>();
        boolean contactInText = false;
        for (String text : signals.detectedText()) {
            brands.addAll(BrandBlocklist.findMentions(text));
            contactInText |= ContactPatterns.containsContactInfo(text);
        }
        List<String> detectedBrands = List.copyOf(brands);
        boolean hasFaces = signals.hasFaces() || signals.faceCount() > 0;
        boolean hasContactInfo = signals.hasContactInfo() || contactInText;
        PrivacySignals effective = new PrivacySignals(signals.textDensity(), signals.detectedText(), signals.hasLogos(),
                signals.logoDescriptions(), hasFaces, signals.faceCount(), hasContactInfo);

        String rejectionReason = null;
        for (PrivacyRule rule : rules) {
            Optional<String> verdict = rule.evaluate(effective, detectedBrands);
            if (verdict.isPresent()) {
                rejectionReason = verdict.get();
                break;
            }
        }

        List<String> warnings = new ArrayList<>();
        if (rejectionReason == null && !signals.detectedText().isEmpty()) {
            warnings.add("Image contains readable text - it will be excluded from extracted patterns");
        }
        return new PrivacyScanResult(rejectionReason == null, hasFaces, signals.hasLogos(), hasContactInfo,
                signals.textDensity(), detectedBrands, rejectionReason, warnings);
    }

    private List<PrivacyRule> builtInRules() {
        return List.of(
                (s, brands) -> s.hasFaces()
                        ? Optional.of("Image contains human faces - cannot process for privacy reasons")
                        : Optional.empty(),
                (s, brands) -> s.textDensity() > maxTextDensity
                        ? Optional.of(String.format("Image contains too much text (%.0f%% coverage) - patterns may leak copyrighted copy", s.textDensity()))
                        : Optional.empty(),
                (s, brands) -> !brands.isEmpty()
                        ? Optional.of("Detected brand names: " + String.join(", ", brands) + " - cannot extract patterns from competitor ads")
                        : Optional.empty(),
                (s, brands) -> s.hasLogos()
                        ? Optional.of("Image contains brand marks or logos - cannot process for trademark reasons")
                        : Optional.empty(),
                (s, brands) -> s.hasContactInfo()
                        ? Optional.of("Image contains legible contact information - cannot process for privacy reasons")
                        : Optional.empty()
        );
    }

    private Optional<PrivacySignals> parseSignals(String responseText) {
        Optional<String> json = ModelResponses.extractJsonObject(responseText);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(json.get());
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            return Optional.of(new PrivacySignals(
                    Math.max(0.0, Math.min(100.0, root.path("textDensity").asDouble(0.0))),
                    readStrings(root.path("detectedText")),
                    root.path("hasLogos").asBoolean(false),
                    readStrings(root.path("logoDescriptions")),
                    root.path("hasFaces").asBoolean(false),
                    root.path("faceCount").asInt(0),
                    root.path("hasContactInfo").asBoolean(false)
            ));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (item != null && item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }

    // Verdict audit trail for reviewing false negatives; never includes the text read from the image
    private PrivacyScanResult audit(PrivacyScanResult result) {
        logger.info("Privacy verdict: safe={}, faces={}, logos={}, contactInfo={}, textDensity={}, brands={}, reason={}",
                result.isSafeToProcess(), result.hasFaces(), result.hasLogos(), result.hasContactInfo(),
                result.textDensity(), result.detectedBrands().size(), result.rejectionReason());
        return result;
    }
}
