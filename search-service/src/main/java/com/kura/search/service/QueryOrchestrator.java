package com.kura.search.service;

import com.kura.search.client.EmbeddingProvider;
import com.kura.search.client.LexicalIndex;
import com.kura.search.client.MetadataStore;
import com.kura.search.client.VectorIndex;
import com.kura.search.config.SearchMode;
import com.kura.search.config.SearchProperties;
import com.kura.search.error.AllSourcesUnavailableException;
import com.kura.search.error.Backend;
import com.kura.search.error.BackendException;
import com.kura.search.error.FailureKind;
import com.kura.search.error.SearchCancelledException;
import com.kura.search.error.ValidationException;
import com.kura.search.model.ContentAttributes;
import com.kura.search.model.ContentMetadata;
import com.kura.search.model.LexicalHit;
import com.kura.search.model.QueryLogEntry;
import com.kura.search.model.RawHit;
import com.kura.search.model.ScoredResult;
import com.kura.search.model.SearchMethod;
import com.kura.search.model.SearchQuery;
import com.kura.search.model.SearchResponse;
import com.kura.search.model.SearchResult;
import com.kura.search.model.SourceMethod;
import com.kura.search.model.VectorHit;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for hybrid search. Validates the request, runs the vector path
 * (embed, then nearest neighbours) and the lexical path concurrently, fuses
 * and filters the candidates, and hydrates the final page.
 *
 * <p>A failing backend is absorbed and the search continues on the other one;
 * only invalid input or the loss of every backend reaches the caller.
 */
@Service
public class QueryOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    private static final String OUTCOME_SUCCESS = "SUCCESS";
    private static final String OUTCOME_EMPTY = "EMPTY";
    private static final String OUTCOME_PARTIAL_VECTOR = "PARTIAL_VECTOR_UNAVAILABLE";
    private static final String OUTCOME_PARTIAL_LEXICAL = "PARTIAL_LEXICAL_UNAVAILABLE";
    private static final String OUTCOME_ALL_UNAVAILABLE = "ALL_SOURCES_UNAVAILABLE";

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;
    private final MetadataStore metadataStore;
    private final QueryLogService queryLogService;
    private final ExecutorService executor;
    private final SearchProperties properties;
    private final MeterRegistry meterRegistry;
    private final QueryValidator validator;
    private final ResultFuser fuser;
    private final FilterEngine filterEngine;
    private final ExcerptGenerator excerptGenerator;

    public QueryOrchestrator(
            EmbeddingProvider embeddingProvider,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            MetadataStore metadataStore,
            ExecutorService executor,
            SearchProperties properties
    ) {
        this(embeddingProvider, vectorIndex, lexicalIndex, metadataStore, null, executor, properties, null);
    }

    @Autowired
    public QueryOrchestrator(
            EmbeddingProvider embeddingProvider,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            MetadataStore metadataStore,
            QueryLogService queryLogService,
            @Qualifier("searchExecutor") ExecutorService executor,
            SearchProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.embeddingProvider = embeddingProvider;
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
        this.metadataStore = metadataStore;
        this.queryLogService = queryLogService;
        this.executor = executor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.validator = new QueryValidator(properties);
        this.fuser = new ResultFuser(lexicalIndex.rankOrder());
        this.filterEngine = new FilterEngine(properties.getMaxWideningRounds());
        this.excerptGenerator = new ExcerptGenerator();
    }

    /**
     * Runs one search for one owner.
     *
     * @throws ValidationException                        on bad input, before any backend is contacted
     * @throws AllSourcesUnavailableException             when no backend could answer
     * @throws SearchCancelledException                   when the calling thread is interrupted
     */
    public SearchResponse search(SearchQuery request) {
        long start = System.nanoTime();
        SearchQuery query = validator.validate(request);
        SearchCall call = new SearchCall(query, UUID.randomUUID().toString().substring(0, 8));
        log.info(
                "trace_id={} event=search_start owner_id={} query=\"{}\" limit={} mode={} filters={}",
                call.traceId,
                query.ownerId(),
                sanitizeForLog(query.query()),
                query.limit(),
                properties.getMode(),
                !query.filters().isEmpty()
        );

        try {
            CandidatePool initial = call.retrieve(call.initialPoolSize);
            if (!call.anySourceSucceeded()) {
                recordOutcome(call, OUTCOME_ALL_UNAVAILABLE, 0, null, start);
                throw new AllSourcesUnavailableException("Search is temporarily unavailable, please retry");
            }

            FilterOutcome filtered = filterEngine.filter(
                    initial,
                    query.filters(),
                    query.ownerId(),
                    query.limit(),
                    call::widen
            );
            if (filtered.wideningRounds() > 0) {
                incrementCounter("search_widening_rounds_total", filtered.wideningRounds());
            }

            List<SearchResult> results = hydrate(filtered.results(), query);
            if (results.isEmpty() && call.degradedWithoutHits()) {
                recordOutcome(call, OUTCOME_ALL_UNAVAILABLE, 0, null, start);
                throw new AllSourcesUnavailableException("Search is temporarily unavailable, please retry");
            }
            SearchMethod method = resolveMethod(results, call);
            String outcome = resolveOutcome(results, call);
            SearchResponse response = new SearchResponse(
                    results,
                    results.size(),
                    method,
                    query.filters(),
                    query.query(),
                    Instant.now()
            );
            log.info(
                    "trace_id={} event=search_complete method={} results={} widening_rounds={} status={} total_ms={}",
                    call.traceId,
                    method.label(),
                    results.size(),
                    filtered.wideningRounds(),
                    outcome,
                    elapsedMillis(start)
            );
            recordOutcome(call, outcome, results.size(), method, start);
            return response;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("trace_id={} event=search_cancelled elapsed_ms={}", call.traceId, elapsedMillis(start));
            incrementCounter("search_cancelled_total", 1);
            throw new SearchCancelledException("Search was cancelled", ex);
        } catch (BackendException ex) {
            // Only metadata failures reach here; the retrieval backends are absorbed in SearchCall.
            logBackendFailure(call, ex, elapsedMillis(start));
            recordOutcome(call, OUTCOME_ALL_UNAVAILABLE, 0, null, start);
            throw new AllSourcesUnavailableException("Search metadata is temporarily unavailable, please retry");
        } finally {
            call.cancelInFlight();
        }
    }

    /**
     * Most recent searches of one owner, newest first. Empty when the query
     * log is disabled.
     */
    public List<QueryLogEntry> history(String ownerId, Integer limit) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner id is required");
        }
        if (queryLogService == null) {
            return List.of();
        }
        return queryLogService.recent(ownerId, limit == null ? 20 : limit);
    }

    private List<SearchResult> hydrate(List<ScoredResult> ranked, SearchQuery query) {
        if (ranked.isEmpty()) {
            return List.of();
        }
        List<String> ids = ranked.stream().map(ScoredResult::id).toList();
        Map<String, ContentMetadata> byId = new HashMap<>();
        for (ContentMetadata metadata : metadataStore.findByIds(ids)) {
            byId.put(metadata.id(), metadata);
        }

        List<SearchResult> results = new ArrayList<>(ranked.size());
        for (ScoredResult scored : ranked) {
            ContentMetadata metadata = byId.get(scored.id());
            if (metadata == null) {
                log.warn("event=hydration_missing id={} owner_id={}", scored.id(), query.ownerId());
                continue;
            }
            if (!Objects.equals(metadata.ownerId(), query.ownerId())) {
                log.warn("event=hydration_foreign_owner id={} owner_id={}", scored.id(), query.ownerId());
                continue;
            }
            results.add(new SearchResult(
                    metadata.id(),
                    metadata.title(),
                    excerptGenerator.excerpt(metadata, query.query()),
                    metadata.contentType(),
                    scored.relevanceScore(),
                    scored.sourceMethod(),
                    metadata.tags(),
                    metadata.createdAt(),
                    metadata.updatedAt(),
                    metadata.ownerId()
            ));
        }
        return results;
    }

    private static SearchMethod resolveMethod(List<SearchResult> results, SearchCall call) {
        if (results.isEmpty()) {
            return SearchMethod.of(call.vectorSucceeded, call.lexicalSucceeded);
        }
        boolean vector = false;
        boolean lexical = false;
        for (SearchResult result : results) {
            vector |= result.sourceMethod() != SourceMethod.LEXICAL;
            lexical |= result.sourceMethod() != SourceMethod.VECTOR;
        }
        return SearchMethod.of(vector, lexical);
    }

    private static String resolveOutcome(List<SearchResult> results, SearchCall call) {
        if (call.vectorFailed) {
            return OUTCOME_PARTIAL_VECTOR;
        }
        if (call.lexicalFailed) {
            return OUTCOME_PARTIAL_LEXICAL;
        }
        return results.isEmpty() ? OUTCOME_EMPTY : OUTCOME_SUCCESS;
    }

    private void recordOutcome(SearchCall call, String outcome, int resultCount, SearchMethod method, long startNanos) {
        if (meterRegistry != null) {
            meterRegistry.counter("search_request_total", "status", outcome).increment();
            meterRegistry.timer("search_request_latency_ms").record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
        if (queryLogService == null) {
            return;
        }
        queryLogService.record(
                call.query.query(),
                resultCount,
                method,
                elapsedMillis(startNanos),
                call.query.ownerId(),
                outcome
        );
    }

    private void logBackendFailure(SearchCall call, BackendException ex, double elapsedMs) {
        log.warn(
                "trace_id={} event=backend_failure backend={} kind={} elapsed_ms={} owner_id={} cause={}",
                call.traceId,
                ex.getBackend().label(),
                ex.getKind().label(),
                elapsedMs,
                call.query.ownerId(),
                ex.getMessage()
        );
        if (meterRegistry != null) {
            meterRegistry.counter(
                    "search_backend_failure_total",
                    "backend", ex.getBackend().label(),
                    "kind", ex.getKind().label()
            ).increment();
        }
    }

    private void recordTimer(Backend backend, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer("search_backend_latency_ms", "backend", backend.label())
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName, double amount) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment(amount);
    }

    private int initialPoolSize(int limit) {
        long pool = (long) limit * Math.max(1, properties.getCandidateMultiplier());
        return (int) Math.max(limit, Math.min(pool, Math.max(limit, properties.getMaxCandidatePool())));
    }

    private static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    /**
     * State of one search: which backends are still usable, the cached query
     * embedding, the attribute cache and the futures that are still running.
     */
    private final class SearchCall {
        private final SearchQuery query;
        private final String traceId;
        private final int initialPoolSize;
        private final List<Future<?>> inFlight = new ArrayList<>();
        private final Map<String, ContentAttributes> attributeCache = new HashMap<>();
        private final Set<String> missingIds = new HashSet<>();
        private float[] queryVector;
        private boolean vectorFailed;
        private boolean lexicalFailed;
        private boolean vectorSucceeded;
        private boolean lexicalSucceeded;
        private boolean anyRawHits;
        private int lastPoolSize;
        private List<VectorHit> lastVectorHits;
        private List<LexicalHit> lastLexicalHits;

        private SearchCall(SearchQuery query, String traceId) {
            this.query = query;
            this.traceId = traceId;
            this.initialPoolSize = initialPoolSize(query.limit());
        }

        private boolean anySourceSucceeded() {
            return vectorSucceeded || lexicalSucceeded;
        }

        // One backend failed and the other found nothing: an empty page would hide the outage.
        private boolean degradedWithoutHits() {
            return (vectorFailed || lexicalFailed) && !anyRawHits;
        }

        CandidatePool widen(int round, Set<String> excludeIds) {
            long requested = (long) initialPoolSize << Math.min(round, 20);
            int k = (int) Math.min(requested, Math.max(initialPoolSize, properties.getMaxWidenedPool()));
            if (k <= lastPoolSize || (vectorFailed && lexicalFailed)) {
                return null;
            }
            missingIds.addAll(excludeIds.stream().filter(id -> !attributeCache.containsKey(id)).toList());
            log.debug("trace_id={} event=widening round={} pool_size={}", traceId, round, k);
            try {
                return retrieve(k);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new SearchCancelledException("Search was cancelled", ex);
            }
        }

        CandidatePool retrieve(int k) throws InterruptedException {
            lastPoolSize = k;
            SearchMode mode = properties.getMode();

            Future<List<LexicalHit>> lexicalFuture = null;
            long lexicalStart = 0L;
            if (mode == SearchMode.COMBINED && !lexicalFailed) {
                lexicalStart = System.nanoTime();
                lexicalFuture = submitLexical(k);
            }

            List<VectorHit> vectorHits = vectorFailed ? null : runVectorPath(k);

            if (mode == SearchMode.FALLBACK && !lexicalFailed
                    && (vectorHits == null || vectorHits.size() < query.limit())) {
                log.info(
                        "trace_id={} event=lexical_fallback reason={} vector_hits={}",
                        traceId,
                        vectorHits == null ? "vector_unavailable" : "vector_short",
                        vectorHits == null ? 0 : vectorHits.size()
                );
                lexicalStart = System.nanoTime();
                lexicalFuture = submitLexical(k);
            }

            List<LexicalHit> lexicalHits = null;
            if (lexicalFuture != null) {
                lexicalHits = awaitLexical(lexicalFuture, lexicalStart);
            }

            // A backend lost while widening keeps contributing the hits of its last good round.
            if (vectorHits != null) {
                lastVectorHits = vectorHits;
            } else if (lastVectorHits != null) {
                log.debug("trace_id={} event=widening_reuse backend=vector hits={}", traceId, lastVectorHits.size());
                vectorHits = lastVectorHits;
            }
            if (lexicalHits != null) {
                lastLexicalHits = lexicalHits;
            } else if (lastLexicalHits != null) {
                log.debug("trace_id={} event=widening_reuse backend=lexical hits={}", traceId, lastLexicalHits.size());
                lexicalHits = lastLexicalHits;
            }

            return buildPool(vectorHits, lexicalHits, k);
        }

        private List<VectorHit> runVectorPath(int k) throws InterruptedException {
            long start = System.nanoTime();
            try {
                if (queryVector == null) {
                    String text = query.query();
                    float[] embedded = await(
                            submit(Backend.EMBEDDING, () -> embeddingProvider.embed(text)),
                            Backend.EMBEDDING,
                            properties.getTimeouts().getEmbeddingMs()
                    );
                    recordTimer(Backend.EMBEDDING, start);
                    if (embedded == null || embedded.length == 0) {
                        throw new BackendException(Backend.EMBEDDING, FailureKind.UNAVAILABLE, "embed_empty_vector");
                    }
                    queryVector = embedded;
                }
                float[] vector = queryVector;
                String ownerId = query.ownerId();
                long vectorStart = System.nanoTime();
                List<VectorHit> hits = await(
                        submit(Backend.VECTOR, () -> vectorIndex.query(vector, k, ownerId)),
                        Backend.VECTOR,
                        properties.getTimeouts().getVectorMs()
                );
                recordTimer(Backend.VECTOR, vectorStart);
                vectorSucceeded = true;
                List<VectorHit> result = hits == null ? List.of() : hits;
                log.debug("trace_id={} stage=vector_search hits={} k={} duration_ms={}", traceId, result.size(), k, elapsedMillis(start));
                return result;
            } catch (BackendException ex) {
                vectorFailed = true;
                logBackendFailure(this, ex, elapsedMillis(start));
                return null;
            }
        }

        private Future<List<LexicalHit>> submitLexical(int k) {
            String text = query.query();
            String ownerId = query.ownerId();
            try {
                return submit(Backend.LEXICAL, () -> lexicalIndex.query(text, k, ownerId));
            } catch (BackendException ex) {
                lexicalFailed = true;
                logBackendFailure(this, ex, 0.0);
                return null;
            }
        }

        private List<LexicalHit> awaitLexical(Future<List<LexicalHit>> future, long startNanos) throws InterruptedException {
            long budgetMs = properties.getTimeouts().getLexicalMs();
            long remainingMs = Math.max(0L, budgetMs - (long) elapsedMillis(startNanos));
            try {
                List<LexicalHit> hits = await(future, Backend.LEXICAL, remainingMs);
                recordTimer(Backend.LEXICAL, startNanos);
                lexicalSucceeded = true;
                List<LexicalHit> result = hits == null ? List.of() : hits;
                log.debug("trace_id={} stage=lexical_search hits={} duration_ms={}", traceId, result.size(), elapsedMillis(startNanos));
                return result;
            } catch (BackendException ex) {
                lexicalFailed = true;
                logBackendFailure(this, ex, elapsedMillis(startNanos));
                return null;
            }
        }

        private CandidatePool buildPool(List<VectorHit> vectorHits, List<LexicalHit> lexicalHits, int k) {
            anyRawHits |= (vectorHits != null && !vectorHits.isEmpty()) || (lexicalHits != null && !lexicalHits.isEmpty());
            boolean truncated = (vectorHits != null && vectorHits.size() >= k)
                    || (lexicalHits != null && lexicalHits.size() >= k);

            List<RawHit> vectorRaw = vectorHits == null ? null : vectorHits.stream()
                    .map(h -> new RawHit(h.id(), h.distance(), SourceMethod.VECTOR))
                    .toList();
            List<RawHit> lexicalRaw = lexicalHits == null ? null : lexicalHits.stream()
                    .map(h -> new RawHit(h.id(), h.rank(), SourceMethod.LEXICAL))
                    .toList();

            Set<String> candidateIds = new LinkedHashSet<>();
            if (vectorRaw != null) {
                vectorRaw.forEach(h -> candidateIds.add(h.id()));
            }
            if (lexicalRaw != null) {
                lexicalRaw.forEach(h -> candidateIds.add(h.id()));
            }
            loadAttributes(candidateIds);

            List<ScoredResult> fused = fuser.fuse(vectorRaw, lexicalRaw, id -> {
                ContentAttributes attrs = attributeCache.get(id);
                return attrs == null ? null : attrs.createdAt();
            });

            Map<String, ContentAttributes> poolAttributes = new HashMap<>();
            for (ScoredResult candidate : fused) {
                ContentAttributes attrs = attributeCache.get(candidate.id());
                if (attrs != null) {
                    poolAttributes.put(candidate.id(), attrs);
                }
            }
            return new CandidatePool(fused, poolAttributes, truncated);
        }

        private void loadAttributes(Set<String> candidateIds) {
            List<String> unknown = candidateIds.stream()
                    .filter(id -> id != null && !attributeCache.containsKey(id) && !missingIds.contains(id))
                    .toList();
            if (unknown.isEmpty()) {
                return;
            }
            long start = System.nanoTime();
            for (ContentAttributes attrs : metadataStore.findAttributes(unknown)) {
                attributeCache.put(attrs.id(), attrs);
            }
            recordTimer(Backend.METADATA, start);
            unknown.stream().filter(id -> !attributeCache.containsKey(id)).forEach(missingIds::add);
        }

        private <T> Future<T> submit(Backend backend, Callable<T> task) {
            try {
                Future<T> future = executor.submit(task);
                inFlight.add(future);
                return future;
            } catch (RejectedExecutionException ex) {
                throw new BackendException(backend, FailureKind.UNAVAILABLE, backend.label() + "_rejected", ex);
            }
        }

        private <T> T await(Future<T> future, Backend backend, long timeoutMs) throws InterruptedException {
            try {
                return future.get(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                future.cancel(true);
                throw new BackendException(backend, FailureKind.TIMEOUT, backend.label() + "_timeout", ex);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                if (cause instanceof BackendException backendException) {
                    throw backendException;
                }
                throw new BackendException(backend, FailureKind.UNAVAILABLE, backend.label() + "_failed: " + cause, cause);
            }
        }

        private void cancelInFlight() {
            for (Future<?> future : inFlight) {
                if (!future.isDone()) {
                    future.cancel(true);
                }
            }
            inFlight.clear();
        }
    }
}
