package com.polymind.ingestion.indexer;

import com.polymind.common.RetryPolicy;
import com.polymind.domain.IndexCursor;
import com.polymind.ingestion.adapter.ChainFetchException;
import com.polymind.ingestion.adapter.ChainLogSource;
import com.polymind.ingestion.adapter.RawLog;
import com.polymind.ingestion.config.IndexerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Sequential block-range indexer: fetch [cursor + 1, min(cursor + batchSize, head)], apply, save cursor.
 * <p>
 * The in-memory cursor moves only after the save succeeds; a batch re-applied after a failed save is a no-op
 * downstream. Retryable fetch failures back off exponentially without limit; an INVALID failure halts.
 * When caught up, the poll interval doubles up to the configured maximum and resets after new blocks.
 */
@Component
@Slf4j
public class BlockRangeIndexer {

    /** {@link #runCycle()} result once halted. */
    public static final long HALTED = -1L;

    private final ChainLogSource chainLogSource;
    private final LogBatchProcessor batchProcessor;
    private final IndexCursorStore cursorStore;
    private final IndexerProperties properties;
    private final RetryPolicy retryPolicy;
    private final IngestionCounters counters;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile IndexerState state = IndexerState.IDLE;
    private volatile IndexCursor cursor;
    private volatile long headBlock = -1L;
    private volatile int consecutiveFailures;
    private volatile long pollIntervalMs;
    private volatile String lastError;
    private volatile String haltReason;
    private volatile Instant lastCommittedAt;

    public BlockRangeIndexer(ChainLogSource chainLogSource,
                             LogBatchProcessor batchProcessor,
                             IndexCursorStore cursorStore,
                             IndexerProperties properties,
                             @Qualifier("indexerRetryPolicy") RetryPolicy retryPolicy,
                             IngestionCounters counters) {
        this.chainLogSource = chainLogSource;
        this.batchProcessor = batchProcessor;
        this.cursorStore = cursorStore;
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.counters = counters;
        this.pollIntervalMs = properties.getPollIntervalMs();
    }

    /**
     * Runs cycles until stopped or halted. Blocks the calling thread.
     */
    public void runLoop() {
        log.info("Indexer started (batchSize={}, pollIntervalMs={})", properties.getBatchSize(), properties.getPollIntervalMs());
        while (stopSignal.getCount() > 0) {
            long delayMs = runCycle();
            if (delayMs == HALTED) {
                return;
            }
            if (delayMs > 0) {
                try {
                    if (stopSignal.await(delayMs, TimeUnit.MILLISECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        state = IndexerState.STOPPED;
        log.info("Indexer stopped at cursor {}", cursor);
    }

    public void stop() {
        stopSignal.countDown();
    }

    /**
     * One fetch/apply/commit step.
     *
     * @return milliseconds to wait before the next cycle (0 when more blocks are ready), or {@link #HALTED}
     */
    public long runCycle() {
        if (state == IndexerState.STOPPED) {
            return HALTED;
        }
        try {
            int seeded = batchProcessor.applyCatalogMarkets();
            if (seeded > 0) {
                log.info("Registered {} catalogue market(s)", seeded);
            }
            state = IndexerState.FETCHING;
            long head = chainLogSource.headBlock();
            headBlock = head;
            if (cursor == null) {
                cursor = initialCursor(head);
                log.info("Indexer cursor initialised at {}", cursor);
            }
            if (cursor.block() >= head) {
                state = IndexerState.IDLE;
                consecutiveFailures = 0;
                long delay = pollIntervalMs;
                pollIntervalMs = Math.min(pollIntervalMs * 2, properties.getMaxPollIntervalMs());
                return delay;
            }
            long from = cursor.block() + 1;
            long to = Math.min(cursor.block() + properties.getBatchSize(), head);
            List<RawLog> logs = chainLogSource.fetchLogs(from, to);

            state = IndexerState.APPLYING;
            BatchResult result = batchProcessor.process(logs, to);
            IndexCursor next = new IndexCursor(to, result.lastLogIndexInEndBlock());
            cursorStore.save(next);
            cursor = next;
            lastCommittedAt = Instant.now();
            consecutiveFailures = 0;
            lastError = null;
            pollIntervalMs = properties.getPollIntervalMs();
            state = IndexerState.IDLE;
            if (result.logs() > 0) {
                log.debug("Indexed blocks {}-{}: {} logs, {} applied, {} skipped",
                        from, to, result.logs(), result.applied(), result.decodeFailures());
            }
            return to < head ? 0L : pollIntervalMs;
        } catch (ChainFetchException e) {
            if (!e.isRetryable()) {
                halt("Fetch failed (" + e.getFailure() + "): " + e.getMessage(), e);
                return HALTED;
            }
            return backoff(e.getFailure() + ": " + e.getMessage());
        } catch (CursorPersistenceException e) {
            return backoff("cursor not saved, batch will be re-applied: " + e.getMessage());
        } catch (DataAccessException e) {
            return backoff("ledger write failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected indexer failure at cursor {}", cursor, e);
            return backoff(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public IndexerStatus status() {
        IndexCursor c = cursor;
        long head = headBlock;
        long cursorBlock = c != null ? c.block() : -1L;
        long lag = c != null && head >= 0 ? Math.max(0L, head - cursorBlock) : -1L;
        return new IndexerStatus(state, cursorBlock, c != null ? c.logIndex() : -1, head, lag,
                consecutiveFailures, pollIntervalMs, counters.snapshot(), lastError, haltReason, lastCommittedAt);
    }

    public IndexerState getState() {
        return state;
    }

    public IndexCursor getCursor() {
        return cursor;
    }

    private IndexCursor initialCursor(long head) {
        return cursorStore.load().orElseGet(() -> {
            if (properties.getStartBlock() != null) {
                return IndexCursor.beforeBlock(properties.getStartBlock());
            }
            return IndexCursor.beforeBlock(Math.max(0L, head - properties.getInitialLookbackBlocks()));
        });
    }

    private long backoff(String reason) {
        int attempt = consecutiveFailures;
        consecutiveFailures = attempt + 1;
        lastError = reason;
        state = IndexerState.BACKOFF;
        long delay = retryPolicy.delayMs(attempt);
        log.warn("Indexer backing off {} ms after failure #{} at cursor {}: {}", delay, attempt + 1, cursor, reason);
        return delay;
    }

    private void halt(String reason, Throwable cause) {
        haltReason = reason;
        lastError = reason;
        state = IndexerState.STOPPED;
        log.error("Indexer halted at cursor {}: {}", cursor, reason, cause);
    }
}
