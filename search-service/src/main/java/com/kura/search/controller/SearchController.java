package com.kura.search.controller;

import com.kura.search.error.ValidationException;
import com.kura.search.model.ContentType;
import com.kura.search.model.QueryLogEntry;
import com.kura.search.model.SearchFilters;
import com.kura.search.model.SearchQuery;
import com.kura.search.model.SearchResponse;
import com.kura.search.service.QueryOrchestrator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/search")
public class SearchController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final QueryOrchestrator orchestrator;

    public SearchController(QueryOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchResponse search(
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "limit", required = false) String limit,
            @RequestParam(value = "contentTypes", required = false) String contentTypes,
            @RequestParam(value = "tags", required = false) String tags,
            @RequestParam(value = "dateFrom", required = false) String dateFrom,
            @RequestParam(value = "dateTo", required = false) String dateTo,
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerId
    ) {
        SearchFilters filters = new SearchFilters(
                parseContentTypes(contentTypes),
                parseTags(tags),
                parseDate("dateFrom", dateFrom, false),
                parseDate("dateTo", dateTo, true)
        );
        return orchestrator.search(new SearchQuery(query, parseLimit(limit), filters, ownerId));
    }

    @GetMapping(value = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<QueryLogEntry> history(
            @RequestParam(value = "limit", required = false) String limit,
            @RequestHeader(value = OWNER_HEADER, required = false) String ownerId
    ) {
        return orchestrator.history(ownerId, parseLimit(limit));
    }

    private static Integer parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException ex) {
            throw new ValidationException("Limit must be a number");
        }
    }

    private static Set<ContentType> parseContentTypes(String raw) {
        Set<ContentType> types = EnumSet.noneOf(ContentType.class);
        for (String value : split(raw)) {
            types.add(ContentType.fromLabel(value));
        }
        return types;
    }

    private static Set<String> parseTags(String raw) {
        return new LinkedHashSet<>(split(raw));
    }

    private static List<String> split(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    // A bare date covers the whole UTC day: start of day for a lower bound, end of day for an upper one.
    private static Instant parseDate(String name, String raw, boolean endOfDay) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            if (value.indexOf('T') < 0) {
                LocalDate date = LocalDate.parse(value);
                return endOfDay
                        ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1)
                        : date.atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            throw new ValidationException(name + " must be an ISO-8601 date or timestamp");
        }
    }
}
