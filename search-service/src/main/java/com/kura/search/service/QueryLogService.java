package com.kura.search.service;

import com.kura.search.config.SearchProperties;
import com.kura.search.model.QueryLogEntry;
import com.kura.search.model.SearchMethod;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget search history. Entries go through a bounded queue drained
 * by one background writer; when the queue is full the oldest entry is
 * dropped so that searches never wait on logging.
 */
@Service
public class QueryLogService implements InitializingBean, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(QueryLogService.class);
    private static final long POLL_INTERVAL_MS = 250L;

    private final QueryLogRepository repository;
    private final MeterRegistry meterRegistry;
    private final boolean enabled;
    private final BlockingQueue<QueryLogEntry> queue;
    private final AtomicLong droppedEntries = new AtomicLong();
    private volatile boolean running;
    private Thread worker;

    public QueryLogService(QueryLogRepository repository, int capacity) {
        this(repository, null, true, capacity);
    }

    @Autowired
    public QueryLogService(QueryLogRepository repository, MeterRegistry meterRegistry, SearchProperties properties) {
        this(repository, meterRegistry, properties.getQueryLog().isEnabled(), properties.getQueryLog().getCapacity());
    }

    public QueryLogService(QueryLogRepository repository, MeterRegistry meterRegistry, boolean enabled, int capacity) {
        this.repository = repository;
        this.meterRegistry = meterRegistry;
        this.enabled = enabled;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public void record(String query, int resultCount, SearchMethod method, double elapsedMs, String ownerId, String outcome) {
        if (!enabled) {
            return;
        }
        try {
            enqueue(new QueryLogEntry(query, resultCount, method, elapsedMs, ownerId, outcome, Instant.now()));
        } catch (RuntimeException ex) {
            log.warn("event=query_log_enqueue_failed cause={}", ex.toString());
        }
    }

    void enqueue(QueryLogEntry entry) {
        while (!queue.offer(entry)) {
            QueryLogEntry dropped = queue.poll();
            if (dropped != null) {
                droppedEntries.incrementAndGet();
                if (meterRegistry != null) {
                    meterRegistry.counter("query_log_dropped_total").increment();
                }
            }
        }
    }

    public List<QueryLogEntry> recent(String ownerId, int limit) {
        return repository.findRecent(ownerId, Math.min(100, Math.max(1, limit)));
    }

    /**
     * Writes everything currently queued. Used by the worker and on shutdown.
     */
    public int drain() {
        List<QueryLogEntry> batch = new ArrayList<>();
        queue.drainTo(batch);
        batch.forEach(this::write);
        return batch.size();
    }

    public int pending() {
        return queue.size();
    }

    public long droppedEntries() {
        return droppedEntries.get();
    }

    @Override
    public void afterPropertiesSet() {
        if (!enabled) {
            return;
        }
        running = true;
        worker = new Thread(this::runWorker, "query-log-writer");
        worker.setDaemon(true);
        worker.start();
        log.info("query log writer started capacity={}", queue.remainingCapacity() + queue.size());
    }

    @Override
    public void destroy() {
        running = false;
        if (worker != null) {
            worker.interrupt();
            try {
                worker.join(TimeUnit.SECONDS.toMillis(2));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        int flushed = drain();
        log.info("query log writer stopped flushed={} dropped_total={}", flushed, droppedEntries.get());
    }

    private void runWorker() {
        while (running) {
            try {
                QueryLogEntry entry = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (entry != null) {
                    write(entry);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void write(QueryLogEntry entry) {
        try {
            repository.append(entry);
        } catch (Exception ex) {
            log.warn("event=query_log_write_skipped owner_id={} cause={}", entry.ownerId(), ex.getMessage());
        }
    }
}
