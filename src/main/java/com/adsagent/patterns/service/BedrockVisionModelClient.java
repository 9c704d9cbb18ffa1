package com.adsagent.patterns.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.io.IOException;
import java.util.Base64;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Calls an Anthropic vision model on Amazon Bedrock with a base64 image content block.
 *
 * Throttling, 5xx answers and client-side timeouts are retried with exponential backoff up to
 * {@code app.model.maxAttempts}; everything else fails immediately.
 */
@Service
public class BedrockVisionModelClient implements VisionModelClient {

    private static final Logger logger = LoggerFactory.getLogger(BedrockVisionModelClient.class);

    private static final Set<String> THROTTLING_CODES = Set.of(
            "ThrottlingException", "TooManyRequestsException", "ProvisionedThroughputExceededException",
            "ServiceUnavailableException", "ModelNotReadyException");
    private static final long MAX_BACKOFF_MS = 8_000L;

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter bedrockRateLimiter;
    private final int maxTokens;
    private final int maxAttempts;
    private final long baseBackoffMs;

    @SuppressWarnings("UnstableApiUsage")
    public BedrockVisionModelClient(BedrockRuntimeClient bedrockClient,
                                    ObjectMapper objectMapper,
                                    @Qualifier("bedrockRateLimiter") RateLimiter bedrockRateLimiter,
                                    @Value("${app.bedrock.maxTokens:1024}") int maxTokens,
                                    @Value("${app.model.maxAttempts:3}") int maxAttempts,
                                    @Value("${app.model.baseBackoffMs:500}") long baseBackoffMs) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.bedrockRateLimiter = bedrockRateLimiter;
        this.maxTokens = Math.max(128, maxTokens);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
    }

    @Override
    public String analyzeImage(VisionRequest request) {
        InvokeModelRequest invokeRequest = buildRequest(request);
        InvokeModelResponse response = invokeWithRetry(invokeRequest, request.operation());
        String responseBody = response.body().asUtf8String();
        try {
            JsonNode contentBlock = objectMapper.readTree(responseBody).path("content");
            if (contentBlock.isArray()) {
                StringBuilder text = new StringBuilder();
                for (JsonNode block : contentBlock) {
                    if ("text".equals(block.path("type").asText("text"))) {
                        text.append(block.path("text").asText(""));
                    }
                }
                return text.toString().trim();
            }
        } catch (IOException e) {
            logger.error("Bedrock {} returned a body that is not JSON.", request.operation(), e);
        }
        // An empty answer is treated downstream as a malformed response, not a transport failure
        logger.warn("Bedrock {} response did not contain a text content block.", request.operation());
        return "";
    }

    private InvokeModelRequest buildRequest(VisionRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", "bedrock-2023-05-31");
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", request.temperature());

        ObjectNode imageSource = objectMapper.createObjectNode();
        imageSource.put("type", "base64");
        imageSource.put("media_type", request.mimeType());
        imageSource.put("data", Base64.getEncoder().encodeToString(request.image()));

        ObjectNode imageBlock = objectMapper.createObjectNode();
        imageBlock.put("type", "image");
        imageBlock.set("source", imageSource);

        ObjectNode textBlock = objectMapper.createObjectNode();
        textBlock.put("type", "text");
        textBlock.put("text", request.instructions());

        ArrayNode content = objectMapper.createArrayNode().add(imageBlock).add(textBlock);
        ObjectNode userMessage = objectMapper.createObjectNode();
        userMessage.put("role", "user");
        userMessage.set("content", content);
        payload.set("messages", objectMapper.createArrayNode().add(userMessage));

        return InvokeModelRequest.builder()
                .modelId(request.modelId())
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(payload.toString()))
                .build();
    }

    /**
     * Invokes Bedrock, backing off exponentially on transient failures.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request, String operation) {
        for (int attempt = 1; ; attempt++) {
            bedrockRateLimiter.acquire();
            RuntimeException failure;
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                if (!isTransient(e)) {
                    String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
                    logger.error("Bedrock {} rejected with status {}: {}", operation, e.statusCode(), detail);
                    throw new ModelTransportException("Model provider rejected " + operation + ": " + detail, e, false);
                }
                failure = e;
            } catch (SdkClientException e) {
                // Covers call/attempt timeouts and connection failures
                failure = e;
            }

            if (attempt >= maxAttempts) {
                logger.warn("Bedrock {} still failing after {} attempts; giving up.", operation, maxAttempts);
                throw new ModelTransportException("Model call " + operation + " failed after " + maxAttempts + " attempts", failure, true);
            }

            long sleepMs = backoffFor(attempt);
            logger.warn("Bedrock {} transient failure (attempt {}/{}). Backing off for {} ms. Error: {}",
                    operation, attempt, maxAttempts, sleepMs, failure.getMessage());
            sleep(sleepMs, operation);
        }
    }

    private boolean isTransient(BedrockRuntimeException e) {
        int statusCode = e.statusCode();
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        return statusCode == 429 || statusCode >= 500 || (code != null && THROTTLING_CODES.contains(code));
    }

    private long backoffFor(int attempt) {
        if (baseBackoffMs == 0) {
            return 0;
        }
        long jitter = ThreadLocalRandom.current().nextLong(50, 200);
        return (long) Math.min(MAX_BACKOFF_MS, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
    }

    private void sleep(long sleepMs, String operation) {
        if (sleepMs <= 0) {
            return;
        }
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ModelTransportException("Interrupted during backoff for " + operation, ie, false);
        }
    }
}
