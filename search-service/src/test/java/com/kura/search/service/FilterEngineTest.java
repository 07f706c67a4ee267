package com.kura.search.service;

import com.kura.search.model.ContentAttributes;
import com.kura.search.model.ContentType;
import com.kura.search.model.ScoredResult;
import com.kura.search.model.SearchFilters;
import com.kura.search.model.SourceMethod;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FilterEngineTest {

    private static final String OWNER = "owner-1";
    private static final Instant JAN = Instant.parse("2024-01-15T00:00:00Z");
    private static final Instant MAR = Instant.parse("2024-03-15T00:00:00Z");

    private final FilterEngine engine = new FilterEngine(3);

    @Test
    void keepsOnlyCandidatesCarryingEveryRequestedTag() {
        CandidatePool pool = pool(false,
                candidate("a", 0.9, OWNER, ContentType.TEXT, List.of("work", "urgent"), JAN),
                candidate("b", 0.8, OWNER, ContentType.TEXT, List.of("work"), JAN),
                candidate("c", 0.7, OWNER, ContentType.TEXT, List.of("urgent", "work", "q1"), JAN)
        );
        SearchFilters filters = new SearchFilters(null, Set.of("work", "urgent"), null, null);

        FilterOutcome outcome = engine.filter(pool, filters, OWNER, 10, null);

        assertThat(outcome.results()).extracting(ScoredResult::id).containsExactly("a", "c");
        assertThat(outcome.wideningRounds()).isZero();
    }

    @Test
    void appliesContentTypeAndInclusiveDateRangeWithoutReordering() {
        CandidatePool pool = pool(false,
                candidate("pdf-jan", 0.9, OWNER, ContentType.PDF, List.of(), JAN),
                candidate("text-mar", 0.8, OWNER, ContentType.TEXT, List.of(), MAR),
                candidate("text-jan", 0.7, OWNER, ContentType.TEXT, List.of(), JAN),
                candidate("image-jan", 0.6, OWNER, ContentType.IMAGE, List.of(), JAN)
        );
        SearchFilters filters = new SearchFilters(Set.of(ContentType.TEXT, ContentType.PDF), null, JAN, JAN);

        FilterOutcome outcome = engine.filter(pool, filters, OWNER, 10, null);

        assertThat(outcome.results()).extracting(ScoredResult::id).containsExactly("pdf-jan", "text-jan");
    }

    @Test
    void dropsForeignAndUnknownCandidates() {
        List<ScoredResult> candidates = List.of(
                new ScoredResult("mine", 0.9, SourceMethod.VECTOR),
                new ScoredResult("theirs", 0.8, SourceMethod.VECTOR),
                new ScoredResult("deleted", 0.7, SourceMethod.LEXICAL)
        );
        Map<String, ContentAttributes> attributes = Map.of(
                "mine", new ContentAttributes("mine", OWNER, ContentType.TEXT, List.of(), JAN),
                "theirs", new ContentAttributes("theirs", "owner-2", ContentType.TEXT, List.of(), JAN)
        );

        FilterOutcome outcome = engine.filter(new CandidatePool(candidates, attributes, false), SearchFilters.none(), OWNER, 10, null);

        assertThat(outcome.results()).extracting(ScoredResult::id).containsExactly("mine");
    }

    @Test
    void widensTruncatedPoolUntilLimitIsFilled() {
        // Top 10 holds 3 tagged items; 7 more tagged items sit just beyond it.
        List<Object[]> ranked = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            boolean tagged = i < 10 ? (i == 1 || i == 4 || i == 8) : i < 17;
            ranked.add(new Object[]{"doc-" + i, 1.0 - i * 0.01, tagged});
        }
        List<Integer> requestedRounds = new ArrayList<>();
        PoolWidener widener = (round, excludeIds) -> {
            requestedRounds.add(round);
            assertThat(excludeIds).hasSize(10);
            return poolOf(ranked, 20, false);
        };
        SearchFilters filters = new SearchFilters(null, Set.of("rare"), null, null);

        FilterOutcome outcome = engine.filter(poolOf(ranked, 10, true), filters, OWNER, 5, widener);

        assertThat(outcome.results()).hasSize(5);
        assertThat(outcome.results()).extracting(ScoredResult::id)
                .containsExactly("doc-1", "doc-4", "doc-8", "doc-10", "doc-11");
        assertThat(outcome.wideningRounds()).isEqualTo(1);
        assertThat(requestedRounds).containsExactly(1);
    }

    @Test
    void wideningIsBoundedByMaxRounds() {
        List<Integer> rounds = new ArrayList<>();
        PoolWidener widener = (round, excludeIds) -> {
            rounds.add(round);
            List<Object[]> ranked = new ArrayList<>();
            for (int i = 0; i < 10 * (round + 1); i++) {
                ranked.add(new Object[]{"doc-" + i, 1.0 - i * 0.001, false});
            }
            return poolOf(ranked, ranked.size(), true);
        };
        List<Object[]> initial = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            initial.add(new Object[]{"doc-" + i, 1.0 - i * 0.001, false});
        }

        FilterOutcome outcome = engine.filter(
                poolOf(initial, 10, true),
                new SearchFilters(null, Set.of("rare"), null, null),
                OWNER,
                5,
                widener
        );

        assertThat(outcome.results()).isEmpty();
        assertThat(outcome.wideningRounds()).isEqualTo(3);
        assertThat(rounds).containsExactly(1, 2, 3);
    }

    @Test
    void doesNotWidenWhenPoolWasNotTruncated() {
        PoolWidener widener = (round, excludeIds) -> {
            throw new AssertionError("pool should not be widened");
        };
        CandidatePool pool = pool(false, candidate("a", 0.5, OWNER, ContentType.AUDIO, List.of(), JAN));

        FilterOutcome outcome = engine.filter(pool, new SearchFilters(Set.of(ContentType.TEXT), null, null, null), OWNER, 5, widener);

        assertThat(outcome.results()).isEmpty();
        assertThat(outcome.wideningRounds()).isZero();
    }

    @Test
    void keepsPreviousPageWhenWidenedPoolPassesFewer() {
        List<Object[]> ranked = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            ranked.add(new Object[]{"doc-" + i, 1.0 - i * 0.01, i < 3});
        }
        // The widened pool lost the tagged head of the previous round.
        PoolWidener widener = (round, excludeIds) -> poolOf(ranked.subList(5, 10), 5, true);

        FilterOutcome outcome = engine.filter(
                poolOf(ranked, 10, true),
                new SearchFilters(null, Set.of("rare"), null, null),
                OWNER,
                5,
                widener
        );

        assertThat(outcome.results()).extracting(ScoredResult::id).containsExactly("doc-0", "doc-1", "doc-2");
    }

    @Test
    void truncatesToLimit() {
        CandidatePool pool = pool(false,
                candidate("a", 0.9, OWNER, ContentType.TEXT, List.of(), JAN),
                candidate("b", 0.8, OWNER, ContentType.TEXT, List.of(), JAN),
                candidate("c", 0.7, OWNER, ContentType.TEXT, List.of(), JAN)
        );

        assertThat(engine.filter(pool, SearchFilters.none(), OWNER, 2, null).results())
                .extracting(ScoredResult::id).containsExactly("a", "b");
    }

    private static CandidatePool poolOf(List<Object[]> ranked, int size, boolean truncated) {
        List<ScoredResult> candidates = new ArrayList<>();
        Map<String, ContentAttributes> attributes = new HashMap<>();
        for (Object[] row : ranked.subList(0, size)) {
            String id = (String) row[0];
            candidates.add(new ScoredResult(id, (Double) row[1], SourceMethod.VECTOR));
            List<String> tags = (Boolean) row[2] ? List.of("rare") : List.of("common");
            attributes.put(id, new ContentAttributes(id, OWNER, ContentType.TEXT, tags, JAN));
        }
        return new CandidatePool(candidates, attributes, truncated);
    }

    private static CandidatePool pool(boolean truncated, Object[]... rows) {
        List<ScoredResult> candidates = new ArrayList<>();
        Map<String, ContentAttributes> attributes = new HashMap<>();
        for (Object[] row : rows) {
            candidates.add((ScoredResult) row[0]);
            ContentAttributes attrs = (ContentAttributes) row[1];
            attributes.put(attrs.id(), attrs);
        }
        return new CandidatePool(candidates, attributes, truncated);
    }

    private static Object[] candidate(String id, double score, String owner, ContentType type, List<String> tags, Instant createdAt) {
        return new Object[]{
                new ScoredResult(id, score, SourceMethod.VECTOR),
                new ContentAttributes(id, owner, type, tags, createdAt)
        };
    }
}
