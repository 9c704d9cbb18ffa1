package com.adsagent.patterns.service;

import com.adsagent.patterns.model.RawPattern;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PatternExtractorTest {

    private static final byte[] IMAGE = {9, 8, 7};

    @Mock
    private VisionModelClient visionModelClient;

    private PatternExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PatternExtractor(visionModelClient, new ObjectMapper(), "vision-model");
    }

    @Test
    void validResponseIsParsedWithoutFlags() {
        when(visionModelClient.analyzeImage(any())).thenReturn(ExtractionFixtures.VALID_RESPONSE);

        RawPattern pattern = extractor.extract(IMAGE, "image/png");

        assertThat(pattern.flags()).isEmpty();
        assertThat(pattern.confidenceScore()).isEqualTo(0.9);
        assertThat(pattern.layoutPattern().getStructure()).isEqualTo("hero-top");
        assertThat(pattern.layoutPattern().getVisualHierarchy()).containsExactly("product image", "headline", "cta button");
        assertThat(pattern.colorPsychology().getContrastLevel()).isEqualTo("high");
        assertThat(pattern.hookPattern().getHeadlineFormula()).isEqualTo("how-to");
        assertThat(pattern.visualElements().isIconography()).isTrue();
        assertThat(pattern.visualElements().isHumanPresence()).isFalse();
    }

    @Test
    void requestCarriesContractPromptAndLowTemperature() {
        when(visionModelClient.analyzeImage(any())).thenReturn(ExtractionFixtures.VALID_RESPONSE);

        extractor.extract(IMAGE, "image/webp");

        ArgumentCaptor<VisionRequest> captor = ArgumentCaptor.forClass(VisionRequest.class);
        verify(visionModelClient).analyzeImage(captor.capture());
        VisionRequest request = captor.getValue();
        assertThat(request.modelId()).isEqualTo("vision-model");
        assertThat(request.temperature()).isEqualTo(0.2);
        assertThat(request.instructions())
                .contains("DO NOT mention any brand names")
                .contains("DO NOT describe faces")
                .contains("hero-top, hero-left");
    }

    @Test
    void markdownFencesAndChatterAreIgnored() {
        RawPattern pattern = extractor.parse("Here you go:\n```json\n" + ExtractionFixtures.VALID_RESPONSE + "\n```");

        assertThat(pattern.flags()).isEmpty();
    }

    @Test
    void responseWithoutJsonIsMalformed() {
        assertThatThrownBy(() -> extractor.parse("Sorry, I can't analyze this image."))
                .isInstanceOf(ExtractionMalformedException.class)
                .satisfies(e -> assertThat(((ExtractionMalformedException) e).getResponseExcerpt())
                        .isEqualTo("Sorry, I can't analyze this image."));
    }

    @Test
    void brokenJsonIsMalformed() {
        assertThatThrownBy(() -> extractor.parse("{\"layoutPattern\": {\"structure\": }"))
                .isInstanceOf(ExtractionMalformedException.class);
    }

    @Test
    void missingSubObjectIsMalformed() {
        String response = ExtractionFixtures.VALID_RESPONSE.replace("\"hookPatterns\"", "\"hooks\"");

        assertThatThrownBy(() -> extractor.parse(response))
                .isInstanceOf(ExtractionMalformedException.class)
                .hasMessageContaining("hookPatterns");
    }

    @Test
    void excerptIsTruncated() {
        String longText = "x".repeat(2_000);

        assertThatThrownBy(() -> extractor.parse(longText))
                .isInstanceOf(ExtractionMalformedException.class)
                .satisfies(e -> assertThat(((ExtractionMalformedException) e).getResponseExcerpt()).hasSize(500));
    }

    @Test
    void outOfRangeConfidenceIsClampedAndFlagged() {
        RawPattern pattern = extractor.parse(ExtractionFixtures.VALID_RESPONSE.replace("0.9", "1.7"));

        assertThat(pattern.flags()).contains("clamped:confidenceScore");
        assertThat(pattern.confidenceScore()).isEqualTo(PatternExtractor.FLAGGED_CONFIDENCE_CAP);
    }

    @Test
    void negativeConfidenceClampsToZero() {
        RawPattern pattern = extractor.parse(ExtractionFixtures.VALID_RESPONSE.replace("0.9", "-0.3"));

        assertThat(pattern.flags()).contains("clamped:confidenceScore");
        assertThat(pattern.confidenceScore()).isZero();
    }

    @Test
    void missingConfidenceDefaultsAndIsFlagged() {
        RawPattern pattern = extractor.parse(ExtractionFixtures.VALID_RESPONSE.replace(",\n  \"confidenceScore\": 0.9", ""));

        assertThat(pattern.flags()).containsExactly("defaulted:confidenceScore");
        assertThat(pattern.confidenceScore()).isEqualTo(0.5);
    }

    @Test
    void offVocabularyValueIsKeptAndFlagged() {
        RawPattern pattern = extractor.parse(ExtractionFixtures.VALID_RESPONSE.replace("\"complementary\"", "\"split-complementary pastel\""));

        assertThat(pattern.colorPsychology().getColorScheme()).isEqualTo("split-complementary pastel");
        assertThat(pattern.flags()).containsExactly("off-vocabulary:colorScheme");
        assertThat(pattern.confidenceScore()).isEqualTo(0.5);
    }

    @Test
    void vocabularyValuesAreCanonicalised() {
        RawPattern pattern = extractor.parse(ExtractionFixtures.VALID_RESPONSE.replace("\"hero-top\"", "\"Hero Top\""));

        assertThat(pattern.layoutPattern().getStructure()).isEqualTo("hero-top");
        assertThat(pattern.flags()).isEmpty();
    }

    @Test
    void longHierarchyIsTruncatedToThree() {
        RawPattern pattern = extractor.parse(ExtractionFixtures.VALID_RESPONSE.replace(
                "\"cta button\"]", "\"cta button\", \"badge\", \"footer\"]"));

        assertThat(pattern.layoutPattern().getVisualHierarchy()).containsExactly("product image", "headline", "cta button");
        assertThat(pattern.flags()).contains("truncated:visualHierarchy");
    }

    @Test
    void missingScalarBecomesNullAndIsFlagged() {
        RawPattern pattern = extractor.parse(ExtractionFixtures.VALID_RESPONSE.replace("\"ctaStyle\": \"direct\",", ""));

        assertThat(pattern.hookPattern().getCtaStyle()).isNull();
        assertThat(pattern.flags()).containsExactly("missing:ctaStyle");
    }

    @Test
    void transportErrorsPropagate() {
        when(visionModelClient.analyzeImage(any())).thenThrow(new ModelTransportException("down", null, true));

        assertThatThrownBy(() -> extractor.extract(IMAGE, "image/png")).isInstanceOf(ModelTransportException.class);
    }
}
