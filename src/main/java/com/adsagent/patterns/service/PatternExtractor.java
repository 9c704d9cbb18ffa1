package com.adsagent.patterns.service;

import com.adsagent.patterns.model.ColorPsychology;
import com.adsagent.patterns.model.HookPattern;
import com.adsagent.patterns.model.LayoutPattern;
import com.adsagent.patterns.model.PatternVocabulary;
import com.adsagent.patterns.model.RawPattern;
import com.adsagent.patterns.model.VisualElements;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asks the vision model for the abstract pattern of an ad and validates the answer against the
 * pattern schema. The model output is untrusted: values are clamped, defaulted or flagged here and
 * stripped of literal content later by {@link PatternSanitizer}.
 */
@Service
public class PatternExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PatternExtractor.class);

    static final double DEFAULT_CONFIDENCE = 0.8;
    static final double FLAGGED_CONFIDENCE_CAP = 0.5;
    static final int MAX_HIERARCHY_ENTRIES = 3;

    private static final String EXTRACTION_PROMPT =
            "Analyze this advertisement image and extract ABSTRACT PATTERNS only.\n" +
                    "\n" +
                    "CRITICAL INSTRUCTIONS - READ CAREFULLY:\n" +
                    "1. DO NOT extract or describe any actual text, headlines, or copy\n" +
                    "2. DO NOT mention any brand names, company names, or product names\n" +
                    "3. DO NOT describe specific products, logos, or trademarks\n" +
                    "4. DO NOT include contact information, URLs, or specific numbers/statistics\n" +
                    "5. DO NOT describe faces or identifiable people\n" +
                    "\n" +
                    "ONLY extract structural and psychological PATTERNS.\n" +
                    "\n" +
                    "Return a JSON object with these exact fields:\n" +
                    "\n" +
                    "{\n" +
                    "  \"layoutPattern\": {\n" +
                    "    \"structure\": \"<one of: " + terms(PatternVocabulary.STRUCTURE) + ">\",\n" +
                    "    \"visualHierarchy\": [\"<first attention element>\", \"<second attention element>\", \"<third attention element>\"],\n" +
                    "    \"whitespaceUsage\": \"<one of: " + terms(PatternVocabulary.WHITESPACE_USAGE) + ">\",\n" +
                    "    \"focalPointPosition\": \"<one of: " + terms(PatternVocabulary.FOCAL_POINT_POSITION) + ">\"\n" +
                    "  },\n" +
                    "  \"colorPsychology\": {\n" +
                    "    \"dominantMood\": \"<one of: " + terms(PatternVocabulary.DOMINANT_MOOD) + ">\",\n" +
                    "    \"colorScheme\": \"<one of: " + terms(PatternVocabulary.COLOR_SCHEME) + ">\",\n" +
                    "    \"contrastLevel\": \"<one of: " + terms(PatternVocabulary.CONTRAST_LEVEL) + ">\",\n" +
                    "    \"emotionalTone\": \"<one of: " + terms(PatternVocabulary.EMOTIONAL_TONE) + ">\"\n" +
                    "  },\n" +
                    "  \"hookPatterns\": {\n" +
                    "    \"hookType\": \"<one of: " + terms(PatternVocabulary.HOOK_TYPE) + ">\",\n" +
                    "    \"headlineFormula\": \"<one of: " + terms(PatternVocabulary.HEADLINE_FORMULA) + ">\",\n" +
                    "    \"ctaStyle\": \"<one of: " + terms(PatternVocabulary.CTA_STYLE) + ">\",\n" +
                    "    \"persuasionTechnique\": \"<one of: " + terms(PatternVocabulary.PERSUASION_TECHNIQUE) + ">\"\n" +
                    "  },\n" +
                    "  \"visualElements\": {\n" +
                    "    \"imageStyle\": \"<one of: " + terms(PatternVocabulary.IMAGE_STYLE) + ">\",\n" +
                    "    \"humanPresence\": <boolean - true if humans are visible, false otherwise>,\n" +
                    "    \"productVisibility\": \"<one of: " + terms(PatternVocabulary.PRODUCT_VISIBILITY) + ">\",\n" +
                    "    \"iconography\": <boolean - true if icons are used, false otherwise>,\n" +
                    "    \"backgroundType\": \"<one of: " + terms(PatternVocabulary.BACKGROUND_TYPE) + ">\"\n" +
                    "  },\n" +
                    "  \"confidenceScore\": <number 0.0-1.0 indicating confidence in this analysis>\n" +
                    "}\n" +
                    "\n" +
                    "Return ONLY generic pattern descriptors. Do not include any specific content from the ad.";

    private final VisionModelClient visionModelClient;
    private final ObjectMapper objectMapper;
    private final String modelId;

    public PatternExtractor(VisionModelClient visionModelClient,
                            ObjectMapper objectMapper,
                            @Value("${aws.bedrock.visionModelId}") String modelId) {
        this.visionModelClient = visionModelClient;
        this.objectMapper = objectMapper;
        this.modelId = modelId;
    }

    /**
     * Runs one model call and turns the answer into a {@link RawPattern}.
     *
     * @throws ModelTransportException      when the model could not be reached within the retry budget
     * @throws ExtractionMalformedException when the answer is not a usable pattern object
     */
    public RawPattern extract(byte[] imageBytes, String mimeType) {
        String responseText = visionModelClient.analyzeImage(
                new VisionRequest("pattern_extraction", modelId, EXTRACTION_PROMPT, imageBytes, mimeType, 0.2));
        return parse(responseText);
    }

    RawPattern parse(String responseText) {
        String excerpt = ModelResponses.excerpt(responseText);
        Optional<String> json = ModelResponses.extractJsonObject(responseText);
        if (json.isEmpty()) {
            logger.error("Pattern extraction response contained no JSON object: {}", excerpt);
            throw new ExtractionMalformedException("Failed to extract patterns from image", excerpt);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json.get());
        } catch (JsonProcessingException e) {
            logger.error("Pattern extraction response was not valid JSON: {}", excerpt);
            throw new ExtractionMalformedException("Pattern extraction returned invalid JSON", excerpt, e);
        }
        if (root == null || !root.isObject()) {
            logger.error("Pattern extraction response was not a JSON object: {}", excerpt);
            throw new ExtractionMalformedException("Pattern extraction returned invalid JSON", excerpt);
        }

        JsonNode layoutNode = requireObject(root, "layoutPattern", excerpt);
        JsonNode colorNode = requireObject(root, "colorPsychology", excerpt);
        JsonNode hookNode = requireObject(root, "hookPatterns", excerpt);
        JsonNode visualNode = requireObject(root, "visualElements", excerpt);

        List<String> flags = new ArrayList<>();

        LayoutPattern layout = LayoutPattern.builder()
                .structure(vocabularyValue(layoutNode, PatternVocabulary.STRUCTURE, flags))
                .visualHierarchy(hierarchy(layoutNode.path("visualHierarchy"), flags))
                .whitespaceUsage(vocabularyValue(layoutNode, PatternVocabulary.WHITESPACE_USAGE, flags))
                .focalPointPosition(vocabularyValue(layoutNode, PatternVocabulary.FOCAL_POINT_POSITION, flags))
                .build();

        ColorPsychology color = ColorPsychology.builder()
                .dominantMood(vocabularyValue(colorNode, PatternVocabulary.DOMINANT_MOOD, flags))
                .colorScheme(vocabularyValue(colorNode, PatternVocabulary.COLOR_SCHEME, flags))
                .contrastLevel(vocabularyValue(colorNode, PatternVocabulary.CONTRAST_LEVEL, flags))
                .emotionalTone(vocabularyValue(colorNode, PatternVocabulary.EMOTIONAL_TONE, flags))
                .build();

        HookPattern hook = HookPattern.builder()
                .hookType(vocabularyValue(hookNode, PatternVocabulary.HOOK_TYPE, flags))
                .headlineFormula(vocabularyValue(hookNode, PatternVocabulary.HEADLINE_FORMULA, flags))
                .ctaStyle(vocabularyValue(hookNode, PatternVocabulary.CTA_STYLE, flags))
                .persuasionTechnique(vocabularyValue(hookNode, PatternVocabulary.PERSUASION_TECHNIQUE, flags))
                .build();

        VisualElements visuals = VisualElements.builder()
                .imageStyle(vocabularyValue(visualNode, PatternVocabulary.IMAGE_STYLE, flags))
                .humanPresence(visualNode.path("humanPresence").asBoolean(false))
                .productVisibility(vocabularyValue(visualNode, PatternVocabulary.PRODUCT_VISIBILITY, flags))
                .iconography(visualNode.path("iconography").asBoolean(false))
                .backgroundType(vocabularyValue(visualNode, PatternVocabulary.BACKGROUND_TYPE, flags))
                .build();

        double confidence = confidence(root.path("confidenceScore"), flags);
        if (!flags.isEmpty()) {
            confidence = Math.min(confidence, FLAGGED_CONFIDENCE_CAP);
            logger.warn("Pattern extraction flagged {} issue(s): {}", flags.size(), flags);
        }
        return new RawPattern(layout, color, hook, visuals, confidence, flags);
    }

    private JsonNode requireObject(JsonNode root, String field, String excerpt) {
        JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            logger.error("Pattern extraction response is missing '{}': {}", field, excerpt);
            throw new ExtractionMalformedException("Pattern extraction response is missing " + field, excerpt);
        }
        return node;
    }

    // Off-vocabulary values are kept verbatim; the sanitizer decides whether they need coercing
    private String vocabularyValue(JsonNode parent, PatternVocabulary vocabulary, List<String> flags) {
        JsonNode node = parent.get(vocabulary.getFieldName());
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            flags.add("missing:" + vocabulary.getFieldName());
            return null;
        }
        String raw = node.asText().trim();
        Optional<String> canonical = vocabulary.canonical(raw);
        if (canonical.isPresent()) {
            return canonical.get();
        }
        flags.add("off-vocabulary:" + vocabulary.getFieldName());
        return raw;
    }

    private List<String> hierarchy(JsonNode node, List<String> flags) {
        List<String> entries = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return entries;
        }
        for (JsonNode item : node) {
            if (item != null && item.isValueNode() && !item.asText().isBlank()) {
                entries.add(item.asText().trim());
            }
        }
        if (entries.size() > MAX_HIERARCHY_ENTRIES) {
            flags.add("truncated:visualHierarchy");
            return new ArrayList<>(entries.subList(0, MAX_HIERARCHY_ENTRIES));
        }
        return entries;
    }

    private double confidence(JsonNode node, List<String> flags) {
        if (node == null || !node.isNumber()) {
            flags.add("defaulted:confidenceScore");
            return DEFAULT_CONFIDENCE;
        }
        double value = node.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            flags.add("clamped:confidenceScore");
            logger.warn("Clamping out-of-range confidence score {}", value);
            return Double.isNaN(value) ? 0.0 : Math.max(0.0, Math.min(1.0, value));
        }
        return value;
    }

    private static String terms(PatternVocabulary vocabulary) {
        return String.join(", ", vocabulary.getValues());
    }
}
