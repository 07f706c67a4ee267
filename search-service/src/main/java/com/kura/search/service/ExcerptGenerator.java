package com.kura.search.service;

import com.kura.search.model.ContentMetadata;
import com.kura.search.model.ContentType;

import java.util.Locale;
import java.util.StringJoiner;

/**
 * Builds the short excerpt shown next to a search result, centred on the first
 * query term found in the stored text.
 */
public class ExcerptGenerator {

    private static final int CONTEXT_BEFORE = 50;

    private final int maxLength;

    public ExcerptGenerator() {
        this(200);
    }

    public ExcerptGenerator(int maxLength) {
        this.maxLength = Math.max(CONTEXT_BEFORE + 1, maxLength);
    }

    public String excerpt(ContentMetadata content, String query) {
        // Images and PDFs are described best by the user's annotation.
        if ((content.contentType() == ContentType.IMAGE || content.contentType() == ContentType.PDF)
                && hasText(content.annotation())) {
            return truncate(content.annotation().trim());
        }

        StringJoiner joiner = new StringJoiner(" ");
        for (String part : new String[]{content.title(), content.annotation(), content.excerptSource()}) {
            if (hasText(part)) {
                joiner.add(part);
            }
        }
        String searchable = joiner.toString();
        if (searchable.isBlank()) {
            String type = content.contentType() == null ? "unknown" : content.contentType().label();
            return "[" + type + " content - no excerpt available]";
        }

        int position = firstTermPosition(searchable, query);
        if (position < 0) {
            return truncate(searchable);
        }
        int start = Math.max(0, position - CONTEXT_BEFORE);
        int end = Math.min(searchable.length(), position + maxLength - CONTEXT_BEFORE);
        String snippet = searchable.substring(start, end);
        if (start > 0) {
            snippet = "..." + snippet;
        }
        if (end < searchable.length()) {
            snippet = snippet + "...";
        }
        return snippet.trim();
    }

    private static int firstTermPosition(String text, String query) {
        if (query == null || query.isBlank()) {
            return -1;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int best = -1;
        for (String term : query.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            int position = lower.indexOf(term);
            if (position != -1 && (best == -1 || position < best)) {
                best = position;
            }
        }
        return best;
    }

    private String truncate(String text) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
