package com.kura.search.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kura.search.error.Backend;
import com.kura.search.error.BackendException;
import com.kura.search.error.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.Map;

@Component
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;
    private final int maxRetries;
    private final long retryDelayMs;
    private final int maxTextLength;

    public OllamaEmbeddingProvider(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String model) {
        this(restTemplate, objectMapper, baseUrl, model, 3, 0L, 8000);
    }

    @Autowired
    public OllamaEmbeddingProvider(
            ObjectMapper objectMapper,
            @Value("${embedding.ollama.base-url:http://ollama:11434}") String baseUrl,
            @Value("${embedding.model:embeddinggemma}") String model,
            @Value("${embedding.request-timeout-ms:1500}") int requestTimeoutMs,
            @Value("${embedding.max-retries:3}") int maxRetries,
            @Value("${embedding.retry-delay-ms:200}") long retryDelayMs,
            @Value("${embedding.max-text-length:8000}") int maxTextLength
    ) {
        this(timeoutRestTemplate(requestTimeoutMs), objectMapper, baseUrl, model, maxRetries, retryDelayMs, maxTextLength);
    }

    OllamaEmbeddingProvider(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            String baseUrl,
            String model,
            int maxRetries,
            long retryDelayMs,
            int maxTextLength
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.model = model;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryDelayMs = Math.max(0L, retryDelayMs);
        this.maxTextLength = Math.max(1, maxTextLength);
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new BackendException(Backend.EMBEDDING, FailureKind.UNAVAILABLE, "embed_empty_text");
        }
        String input = text.length() > maxTextLength ? text.substring(0, maxTextLength) : text;
        if (input.length() < text.length()) {
            log.warn("event=embedding_input_truncated original_length={} truncated_length={}", text.length(), input.length());
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("input", input);

        BackendException lastFailure = null;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                String response = restTemplate.postForObject(baseUrl + "/api/embed", payload, String.class);
                return parseEmbedding(response);
            } catch (HttpStatusCodeException ex) {
                lastFailure = classify(ex.getStatusCode(), ex);
                if (!isRetryable(ex.getStatusCode())) {
                    throw lastFailure;
                }
            } catch (ResourceAccessException ex) {
                FailureKind kind = ex.getCause() instanceof SocketTimeoutException
                        ? FailureKind.TIMEOUT
                        : FailureKind.UNAVAILABLE;
                lastFailure = new BackendException(Backend.EMBEDDING, kind, "embed_" + kind.label(), ex);
            }

            if (attempt < maxRetries - 1) {
                long delay = retryDelayMs * (1L << attempt);
                log.debug("event=embedding_retry attempt={} kind={} delay_ms={}", attempt + 1, lastFailure.getKind().label(), delay);
                sleep(delay);
            }
        }
        throw lastFailure;
    }

    private float[] parseEmbedding(String response) {
        if (response == null || response.isBlank()) {
            throw new BackendException(Backend.EMBEDDING, FailureKind.UNAVAILABLE, "embed_empty_response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (IOException ex) {
            throw new BackendException(Backend.EMBEDDING, FailureKind.UNAVAILABLE, "embed_malformed_response", ex);
        }
        JsonNode embeddingNode = root.path("embedding");
        if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
            // /api/embed shape: { "embeddings": [[...]] }
            JsonNode embeddingsNode = root.path("embeddings");
            if (embeddingsNode.isArray() && !embeddingsNode.isEmpty() && embeddingsNode.get(0).isArray()) {
                embeddingNode = embeddingsNode.get(0);
            }
        }
        if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
            throw new BackendException(Backend.EMBEDDING, FailureKind.UNAVAILABLE, "embed_empty_vector");
        }
        float[] vector = new float[embeddingNode.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = embeddingNode.get(i);
            if (!value.isNumber()) {
                throw new BackendException(Backend.EMBEDDING, FailureKind.UNAVAILABLE, "embed_non_numeric_component");
            }
            vector[i] = (float) value.asDouble();
        }
        return vector;
    }

    private static BackendException classify(HttpStatusCode status, Exception cause) {
        int code = status.value();
        FailureKind kind;
        if (code == 401 || code == 403) {
            kind = FailureKind.AUTH_FAILED;
        } else if (code == 429) {
            kind = FailureKind.RATE_LIMITED;
        } else if (code == 408 || code == 504) {
            kind = FailureKind.TIMEOUT;
        } else {
            kind = FailureKind.UNAVAILABLE;
        }
        return new BackendException(Backend.EMBEDDING, kind, "embed_http_" + code, cause);
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == 429 || status.value() == 408;
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BackendException(Backend.EMBEDDING, FailureKind.UNAVAILABLE, "embed_interrupted", ex);
        }
    }

    private static RestTemplate timeoutRestTemplate(int requestTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.max(50, requestTimeoutMs));
        factory.setReadTimeout(Math.max(50, requestTimeoutMs));
        return new RestTemplate(factory);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
