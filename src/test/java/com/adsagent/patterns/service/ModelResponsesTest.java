package com.adsagent.patterns.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModelResponsesTest {

    @Test
    void extractsObjectFromFencedText() {
        assertThat(ModelResponses.extractJsonObject("```json\n{\"a\": {\"b\": 1}}\n```")).contains("{\"a\": {\"b\": 1}}");
    }

    @Test
    void extractsObjectSurroundedByProse() {
        assertThat(ModelResponses.extractJsonObject("Sure! {\"a\":1} Hope this helps.")).contains("{\"a\":1}");
    }

    @Test
    void noBracesMeansNoObject() {
        assertThat(ModelResponses.extractJsonObject("no json here")).isEmpty();
        assertThat(ModelResponses.extractJsonObject("} backwards {")).isEmpty();
        assertThat(ModelResponses.extractJsonObject(null)).isEmpty();
    }
}
