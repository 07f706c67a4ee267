package com.kura.search.service;

import com.kura.search.model.QueryLogEntry;
import com.kura.search.model.SearchMethod;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryLogServiceTest {

    @Test
    void fullQueueDropsOldestEntry() {
        QueryLogRepository repository = mock(QueryLogRepository.class);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        QueryLogService service = new QueryLogService(repository, registry, true, 2);

        service.record("first", 1, SearchMethod.VECTOR, 5.0, "owner-1", "SUCCESS");
        service.record("second", 2, SearchMethod.FTS, 5.0, "owner-1", "SUCCESS");
        service.record("third", 3, SearchMethod.COMBINED, 5.0, "owner-1", "SUCCESS");

        assertThat(service.pending()).isEqualTo(2);
        assertThat(service.droppedEntries()).isEqualTo(1);
        assertThat(registry.counter("query_log_dropped_total").count()).isEqualTo(1.0);

        assertThat(service.drain()).isEqualTo(2);
        ArgumentCaptor<QueryLogEntry> written = ArgumentCaptor.forClass(QueryLogEntry.class);
        verify(repository, times(2)).append(written.capture());
        assertThat(written.getAllValues()).extracting(QueryLogEntry::query).containsExactly("second", "third");
    }

    @Test
    void writeFailureIsNotPropagated() {
        QueryLogRepository repository = mock(QueryLogRepository.class);
        doThrow(new IllegalStateException("db down")).when(repository).append(any());
        QueryLogService service = new QueryLogService(repository, 10);

        service.record("notes", 0, null, 1.0, "owner-1", "ALL_SOURCES_UNAVAILABLE");

        assertThatCode(service::drain).doesNotThrowAnyException();
        assertThat(service.pending()).isZero();
    }

    @Test
    void disabledLogIgnoresRecords() {
        QueryLogRepository repository = mock(QueryLogRepository.class);
        QueryLogService service = new QueryLogService(repository, null, false, 10);

        service.record("notes", 0, SearchMethod.FTS, 1.0, "owner-1", "EMPTY");
        service.drain();

        assertThat(service.pending()).isZero();
        verify(repository, never()).append(any());
    }

    @Test
    void workerWritesQueuedEntriesAndFlushesOnShutdown() throws Exception {
        QueryLogRepository repository = mock(QueryLogRepository.class);
        QueryLogService service = new QueryLogService(repository, 10);
        service.afterPropertiesSet();

        service.record("notes", 4, SearchMethod.COMBINED, 12.5, "owner-1", "SUCCESS");
        service.destroy();

        assertThat(service.pending()).isZero();
        verify(repository).append(any(QueryLogEntry.class));
    }

    @Test
    void recentClampsLimit() {
        QueryLogRepository repository = mock(QueryLogRepository.class);
        QueryLogEntry entry = new QueryLogEntry("notes", 1, SearchMethod.FTS, 3.0, "owner-1", "SUCCESS", Instant.now());
        when(repository.findRecent("owner-1", 100)).thenReturn(List.of(entry));
        QueryLogService service = new QueryLogService(repository, 10);

        assertThat(service.recent("owner-1", 500)).containsExactly(entry);
    }
}
