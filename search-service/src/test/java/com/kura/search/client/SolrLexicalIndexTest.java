package com.kura.search.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kura.search.error.Backend;
import com.kura.search.error.BackendException;
import com.kura.search.error.FailureKind;
import com.kura.search.model.LexicalHit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolrLexicalIndexTest {

    private static SolrLexicalIndex respondingWith(String body) {
        return new SolrLexicalIndex("http://localhost:8983/solr/content", new ObjectMapper()) {
            @Override
            protected String select(String text, int k, String ownerId) {
                return body;
            }
        };
    }

    @Test
    void mapsDocsToHitsUsingScoreAsRank() {
        SolrLexicalIndex index = respondingWith("{\"response\":{\"docs\":[" +
                "{\"id\":\"doc-001\",\"score\":4.2}," +
                "{\"id\":\"doc-002\",\"score\":1.5}]}}");

        List<LexicalHit> hits = index.query("budget", 10, "owner-1");

        assertThat(hits).extracting(LexicalHit::id).containsExactly("doc-001", "doc-002");
        assertThat(hits).extracting(LexicalHit::rank).containsExactly(4.2, 1.5);
        assertThat(index.rankOrder()).isEqualTo(RankOrder.HIGHER_IS_BETTER);
    }

    @Test
    void keepsResponseOrderWhenScoresAreMissing() {
        SolrLexicalIndex index = respondingWith("{\"response\":{\"docs\":[" +
                "{\"id\":\"first\"},{\"id\":\"\"},{\"id\":\"third\"}]}}");

        List<LexicalHit> hits = index.query("budget", 10, "owner-1");

        assertThat(hits).extracting(LexicalHit::id).containsExactly("first", "third");
        assertThat(hits.get(0).rank()).isGreaterThan(hits.get(1).rank());
    }

    @Test
    void responseWithoutDocsHasNoHits() {
        assertThat(respondingWith("{\"responseHeader\":{\"status\":0}}").query("budget", 10, "owner-1")).isEmpty();
    }

    @Test
    void malformedResponseIsUnavailable() {
        assertThatThrownBy(() -> respondingWith("<html>502</html>").query("budget", 10, "owner-1"))
                .isInstanceOf(BackendException.class)
                .satisfies(ex -> {
                    BackendException backend = (BackendException) ex;
                    assertThat(backend.getBackend()).isEqualTo(Backend.LEXICAL);
                    assertThat(backend.getKind()).isEqualTo(FailureKind.UNAVAILABLE);
                });
    }

    @Test
    void ownerFilterQuotesAndEscapesOwnerId() {
        assertThat(SolrLexicalIndex.ownerFilter("owner-1")).isEqualTo("owner_id:\"owner-1\"");
        assertThat(SolrLexicalIndex.ownerFilter("a\"b")).isEqualTo("owner_id:\"a\\\"b\"");
    }
}
