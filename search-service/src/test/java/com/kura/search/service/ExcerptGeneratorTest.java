package com.kura.search.service;

import com.kura.search.model.ContentMetadata;
import com.kura.search.model.ContentType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExcerptGeneratorTest {

    private final ExcerptGenerator generator = new ExcerptGenerator();

    private static ContentMetadata content(ContentType type, String title, String annotation, String text) {
        Instant now = Instant.parse("2024-02-01T10:00:00Z");
        return new ContentMetadata("c-1", "owner-1", title, type, List.of(), now, now, "web", annotation, text);
    }

    @Test
    void centresOnFirstMatchingTerm() {
        String text = "a".repeat(300) + " quarterly budget review " + "b".repeat(300);

        String excerpt = generator.excerpt(content(ContentType.TEXT, null, null, text), "budget");

        assertThat(excerpt).startsWith("...").endsWith("...").contains("budget");
        assertThat(excerpt.length()).isLessThanOrEqualTo(206);
    }

    @Test
    void shortTextIsReturnedWhole() {
        String excerpt = generator.excerpt(content(ContentType.TEXT, "Groceries", null, "milk and eggs"), "eggs");

        assertThat(excerpt).isEqualTo("Groceries milk and eggs");
    }

    @Test
    void imagesUseTheirAnnotation() {
        String excerpt = generator.excerpt(
                content(ContentType.IMAGE, "IMG_0042", "whiteboard from the planning session", null),
                "planning"
        );

        assertThat(excerpt).isEqualTo("whiteboard from the planning session");
    }

    @Test
    void contentWithoutTextGetsPlaceholder() {
        assertThat(generator.excerpt(content(ContentType.AUDIO, null, null, null), "anything"))
                .isEqualTo("[audio content - no excerpt available]");
    }

    @Test
    void unmatchedQueryFallsBackToLeadingText() {
        String text = "c".repeat(500);

        String excerpt = generator.excerpt(content(ContentType.TEXT, null, null, text), "missing");

        assertThat(excerpt).hasSize(203).endsWith("...");
    }
}
