package com.kura.search.service;

import com.kura.search.client.RankOrder;
import com.kura.search.model.RawHit;
import com.kura.search.model.ScoredResult;
import com.kura.search.model.SourceMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Normalises vector and lexical hits onto a shared [0,1] scale, merges them by
 * id and ranks the result. Limits and filters are applied later.
 */
public class ResultFuser {

    private static final Logger log = LoggerFactory.getLogger(ResultFuser.class);

    private final RankOrder lexicalRankOrder;

    public ResultFuser() {
        this(RankOrder.HIGHER_IS_BETTER);
    }

    public ResultFuser(RankOrder lexicalRankOrder) {
        this.lexicalRankOrder = lexicalRankOrder == null ? RankOrder.HIGHER_IS_BETTER : lexicalRankOrder;
    }

    public List<ScoredResult> fuse(List<RawHit> vectorHits, List<RawHit> lexicalHits) {
        return fuse(vectorHits, lexicalHits, id -> null);
    }

    /**
     * @param createdAtLookup creation time per id for tie-breaking; may return null
     */
    public List<ScoredResult> fuse(
            List<RawHit> vectorHits,
            List<RawHit> lexicalHits,
            Function<String, Instant> createdAtLookup
    ) {
        Map<String, MergedScore> merged = new LinkedHashMap<>();

        if (vectorHits != null) {
            for (RawHit hit : vectorHits) {
                merge(merged, hit.id(), similarityFromDistance(hit.rawScore()), SourceMethod.VECTOR);
            }
        }

        if (lexicalHits != null && !lexicalHits.isEmpty()) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (RawHit hit : lexicalHits) {
                min = Math.min(min, hit.rawScore());
                max = Math.max(max, hit.rawScore());
            }
            for (RawHit hit : lexicalHits) {
                merge(merged, hit.id(), normalizeRank(hit.rawScore(), min, max), SourceMethod.LEXICAL);
            }
        }

        List<ScoredResult> fused = new ArrayList<>(merged.size());
        for (MergedScore m : merged.values()) {
            fused.add(new ScoredResult(m.id, m.score, m.sourceMethod()));
        }
        fused.sort(rankingOrder(createdAtLookup));

        log.debug(
                "event=fusion_complete vector_hits={} lexical_hits={} fused={}",
                vectorHits == null ? 0 : vectorHits.size(),
                lexicalHits == null ? 0 : lexicalHits.size(),
                fused.size()
        );
        return fused;
    }

    /**
     * Descending score, then more recent first, then id for a stable order.
     */
    public static Comparator<ScoredResult> rankingOrder(Function<String, Instant> createdAtLookup) {
        Comparator<ScoredResult> byCreatedAt = Comparator.comparing(
                (ScoredResult r) -> createdAtLookup.apply(r.id()),
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())
        );
        return Comparator.comparingDouble(ScoredResult::relevanceScore).reversed()
                .thenComparing(byCreatedAt)
                .thenComparing(ScoredResult::id);
    }

    static double similarityFromDistance(double distance) {
        return clamp(1.0 - distance);
    }

    double normalizeRank(double rank, double min, double max) {
        if (max == min) {
            return 1.0;
        }
        double scaled = (rank - min) / (max - min);
        if (lexicalRankOrder == RankOrder.LOWER_IS_BETTER) {
            scaled = 1.0 - scaled;
        }
        return clamp(scaled);
    }

    private static void merge(Map<String, MergedScore> merged, String id, double score, SourceMethod source) {
        if (id == null || id.isBlank()) {
            return;
        }
        MergedScore m = merged.computeIfAbsent(id, MergedScore::new);
        if (source == SourceMethod.VECTOR) {
            m.vector = true;
        } else {
            m.lexical = true;
        }
        m.score = Math.max(m.score, score);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }

    private static class MergedScore {
        private final String id;
        private double score;
        private boolean vector;
        private boolean lexical;

        private MergedScore(String id) {
            this.id = id;
        }

        private SourceMethod sourceMethod() {
            if (vector && lexical) {
                return SourceMethod.COMBINED;
            }
            return vector ? SourceMethod.VECTOR : SourceMethod.LEXICAL;
        }
    }
}
