package com.kura.search.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kura.search.error.Backend;
import com.kura.search.error.BackendException;
import com.kura.search.error.FailureKind;
import com.kura.search.model.LexicalHit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Solr {@code /select} over the content core. Relevance score is used as the
 * rank (higher is better).
 */
@Component
public class SolrLexicalIndex implements LexicalIndex {

    private static final String EMPTY_RESPONSE = "{\"response\":{\"docs\":[]}}";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String queryFields;
    private final long requestTimeoutMs;

    public SolrLexicalIndex(String solrUrl, ObjectMapper objectMapper) {
        this(solrUrl, "title_t annotation_t extracted_text_t", 800L, objectMapper);
    }

    @Autowired
    public SolrLexicalIndex(
            @Value("${solr.url:http://solr:8983/solr/content}") String solrUrl,
            @Value("${solr.query-fields:title_t annotation_t extracted_text_t}") String queryFields,
            @Value("${solr.request-timeout-ms:800}") long requestTimeoutMs,
            ObjectMapper objectMapper
    ) {
        this.webClient = WebClient.builder().baseUrl(solrUrl).build();
        this.objectMapper = objectMapper;
        this.queryFields = queryFields;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public List<LexicalHit> query(String text, int k, String ownerId) {
        return parseHits(select(text, k, ownerId));
    }

    protected String select(String text, int k, String ownerId) {
        try {
            String body = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/select")
                            .queryParam("q", "{q}")
                            .queryParam("defType", "edismax")
                            .queryParam("qf", "{qf}")
                            .queryParam("fq", "{fq}")
                            .queryParam("fl", "id,score")
                            .queryParam("rows", k)
                            .queryParam("wt", "json")
                            .build(text, queryFields, ownerFilter(ownerId)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(requestTimeoutMs));
            return body == null ? EMPTY_RESPONSE : body;
        } catch (WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            FailureKind kind = (status == 401 || status == 403) ? FailureKind.AUTH_FAILED
                    : status == 429 ? FailureKind.RATE_LIMITED
                    : FailureKind.UNAVAILABLE;
            throw new BackendException(Backend.LEXICAL, kind, "lexical_http_" + status, ex);
        } catch (WebClientRequestException ex) {
            throw new BackendException(Backend.LEXICAL, FailureKind.UNAVAILABLE, "lexical_unreachable", ex);
        } catch (IllegalStateException ex) {
            // Mono.block(Duration) signals an elapsed timeout this way
            if (ex.getCause() instanceof TimeoutException) {
                throw new BackendException(Backend.LEXICAL, FailureKind.TIMEOUT, "lexical_timeout", ex);
            }
            throw new BackendException(Backend.LEXICAL, FailureKind.UNAVAILABLE, "lexical_query_failed", ex);
        }
    }

    List<LexicalHit> parseHits(String solrJson) {
        JsonNode docs;
        try {
            docs = objectMapper.readTree(solrJson).path("response").path("docs");
        } catch (IOException ex) {
            throw new BackendException(Backend.LEXICAL, FailureKind.UNAVAILABLE, "lexical_malformed_response", ex);
        }
        List<LexicalHit> hits = new ArrayList<>();
        if (!docs.isArray()) {
            return hits;
        }
        int total = docs.size();
        for (int idx = 0; idx < total; idx++) {
            JsonNode node = docs.get(idx);
            String id = node.path("id").asText(null);
            if (id == null || id.isBlank()) {
                continue;
            }
            JsonNode score = node.get("score");
            // Without a score, keep Solr's ordering as the rank.
            double rank = score != null && score.isNumber() ? score.asDouble() : (double) (total - idx);
            hits.add(new LexicalHit(id, rank));
        }
        return hits;
    }

    static String ownerFilter(String ownerId) {
        String escaped = ownerId.replace("\\", "\\\\").replace("\"", "\\\"");
        return "owner_id:\"" + escaped + "\"";
    }
}
