package com.delangzeta.realtime.ingestion.connector;

import com.delangzeta.realtime.common.RetryPolicy;
import com.delangzeta.realtime.domain.ChainCursor;
import com.delangzeta.realtime.ingestion.adapter.ChainEndpoint;
import com.delangzeta.realtime.ingestion.adapter.ChainLogSource;
import com.delangzeta.realtime.ingestion.adapter.ChainLogSourceFactory;
import com.delangzeta.realtime.ingestion.adapter.RawLog;
import com.delangzeta.realtime.ingestion.adapter.RpcException;
import com.delangzeta.realtime.ingestion.pipeline.EventIngestionPipeline;
import com.delangzeta.realtime.ingestion.store.ChainCursorService;
import com.delangzeta.realtime.topic.TopicPublishException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import reactor.core.Disposable;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Long-running worker for one (chain, contract). Each session opens a fresh log source, subscribes to live
 * logs into an inbox, replays [cursor, head] with eth_getLogs, then drains the inbox. Everything that
 * reaches the pipeline is handled sequentially on this thread, so per-contract order is block then log index.
 * Logs at or below the cursor are skipped; the live/replay overlap is absorbed that way.
 * <p>
 * Session failures (RPC, store, topic) end the session and reconnect with capped exponential backoff,
 * forever, until {@link #stop()}.
 */
@Slf4j
public class ChainConnector implements Runnable {

    private static final long INBOX_POLL_MS = 500;
    private static final Comparator<RawLog> LOG_ORDER = Comparator
            .comparing(RawLog::blockNumber, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
            .thenComparing(RawLog::logIndex, Comparator.nullsFirst(Comparator.<Long>naturalOrder()));

    private final ConnectorDefinition definition;
    private final int replayBatchBlocks;
    private final ChainLogSourceFactory sourceFactory;
    private final ContractEventDecoder decoder;
    private final EventIngestionPipeline pipeline;
    private final ChainCursorService cursorService;
    private final RetryPolicy reconnectPolicy;
    private final RateLimiter rpcLimiter;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processedLogs = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private volatile ConnectorState state = ConnectorState.STOPPED;
    private volatile ChainCursor cursor;
    private volatile Thread worker;
    private boolean sessionReachedLive;

    public ChainConnector(ConnectorDefinition definition, int replayBatchBlocks, ChainLogSourceFactory sourceFactory,
                          ContractEventDecoder decoder, EventIngestionPipeline pipeline, ChainCursorService cursorService,
                          RetryPolicy reconnectPolicy, RateLimiter rpcLimiter) {
        if (replayBatchBlocks <= 0) {
            throw new IllegalArgumentException("replayBatchBlocks must be positive");
        }
        this.definition = definition;
        this.replayBatchBlocks = replayBatchBlocks;
        this.sourceFactory = sourceFactory;
        this.decoder = decoder;
        this.pipeline = pipeline;
        this.cursorService = cursorService;
        this.reconnectPolicy = reconnectPolicy;
        this.rpcLimiter = rpcLimiter;
    }

    public String key() {
        return definition.key();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Marks the connector as started before its task is scheduled, so status never reports a gap. */
    void markStarting() {
        running.set(true);
        state = ConnectorState.STARTING;
    }

    public void stop() {
        running.set(false);
        Thread t = worker;
        if (t != null) {
            t.interrupt();
        }
    }

    public ConnectorStatus status() {
        ChainCursor c = cursor;
        ChainEndpoint endpoint = definition.endpoint();
        return new ConnectorStatus(key(), endpoint.chain(), endpoint.contractAddress(), state,
                c == null ? null : c.getLastProcessedBlock(),
                c == null ? null : c.getLastLogIndex(),
                processedLogs.get(), reconnects.get());
    }

    @Override
    public void run() {
        worker = Thread.currentThread();
        running.set(true);
        log.info("Connector {} started", key());
        int attempt = 0;
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    runSession();
                    log.warn("Live log stream for {} completed", key());
                } catch (RuntimeException e) {
                    if (!running.get()) {
                        break;
                    }
                    log.warn("Connector {} session failed: {}", key(), e.toString());
                }
                if (!running.get()) {
                    break;
                }
                if (sessionReachedLive) {
                    attempt = 0;
                }
                state = ConnectorState.BACKOFF;
                reconnects.incrementAndGet();
                long delay = reconnectPolicy.delayMs(attempt++);
                log.info("Connector {} reconnecting in {} ms (attempt {})", key(), delay, attempt);
                Thread.sleep(delay);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            state = ConnectorState.STOPPED;
            worker = null;
            log.info("Connector {} stopped", key());
        }
    }

    private void runSession() throws InterruptedException {
        sessionReachedLive = false;
        state = ConnectorState.STARTING;
        try (ChainLogSource source = sourceFactory.open(definition.endpoint())) {
            source.connect();
            BlockingQueue<RawLog> inbox = new LinkedBlockingQueue<>();
            AtomicReference<Throwable> streamError = new AtomicReference<>();
            AtomicBoolean streamEnded = new AtomicBoolean(false);
            Disposable subscription = source.logs().subscribe(
                    inbox::add,
                    error -> {
                        streamError.set(error);
                        streamEnded.set(true);
                    },
                    () -> streamEnded.set(true));
            try {
                state = ConnectorState.REPLAYING;
                replay(source);
                state = ConnectorState.LIVE;
                sessionReachedLive = true;
                log.info("Connector {} is live", key());
                while (running.get()) {
                    RawLog next = inbox.poll(INBOX_POLL_MS, TimeUnit.MILLISECONDS);
                    if (next != null) {
                        handle(next);
                    } else if (streamEnded.get()) {
                        break;
                    }
                }
            } finally {
                subscription.dispose();
            }
            Throwable error = streamError.get();
            if (error != null && running.get()) {
                throw new RpcException("Live log stream failed for " + key(), error);
            }
        }
    }

    void replay(ChainLogSource source) {
        ChainEndpoint endpoint = definition.endpoint();
        long head = rpc(source::headBlock);
        cursor = cursorService.find(endpoint.chain(), endpoint.contractAddress()).orElse(null);
        long from;
        if (cursor != null) {
            // same block again: logs after lastLogIndex may still be pending
            from = cursor.getLastProcessedBlock();
        } else if (definition.startBlock() != null) {
            from = definition.startBlock();
        } else {
            log.info("No cursor for {}; following from head {}", key(), head);
            return;
        }
        if (from > head) {
            return;
        }
        log.info("Connector {} replaying blocks {}..{}", key(), from, head);
        for (long start = from; start <= head && running.get(); start += replayBatchBlocks) {
            long rangeStart = start;
            long rangeEnd = Math.min(head, start + replayBatchBlocks - 1);
            List<RawLog> logs = rpc(() -> source.getLogs(rangeStart, rangeEnd));
            logs.stream().sorted(LOG_ORDER).forEach(this::handle);
        }
    }

    /**
     * Logs in blocks before the cursor are skipped. Logs in the cursor's own block are always handed to the
     * pipeline, which dedupes on the event id, so one arriving out of order within that block is not lost.
     */
    void handle(RawLog raw) {
        ChainCursor current = cursor;
        boolean covered = false;
        if (current != null && raw.blockNumber() != null && raw.logIndex() != null
                && current.covers(raw.blockNumber(), raw.logIndex())) {
            if (raw.blockNumber() < current.getLastProcessedBlock()) {
                log.debug("Connector {} skips {}#{} below cursor", key(), raw.blockNumber(), raw.logIndex());
                return;
            }
            covered = true;
        }
        DecodedLog decoded;
        try {
            decoded = decoder.decode(definition.endpoint().chain(), raw);
        } catch (MalformedLogException e) {
            log.warn("Connector {} skips malformed log: {}", key(), e.getMessage());
            return;
        }
        try {
            int ingested = pipeline.ingest(decoded);
            if (covered && ingested > 0) {
                log.warn("Connector {} ingested out-of-order log {}#{} behind cursor {}#{}", key(),
                        decoded.blockNumber(), decoded.logIndex(), current.getLastProcessedBlock(), current.getLastLogIndex());
            }
        } catch (RpcException | DataAccessException | TopicPublishException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Connector {} dropped {} in tx {} after processing failure",
                    key(), decoded.eventName(), decoded.transactionHash(), e);
        }
        ChainEndpoint endpoint = definition.endpoint();
        cursor = cursorService.advance(endpoint.chain(), endpoint.contractAddress(), decoded.blockNumber(), decoded.logIndex());
        processedLogs.incrementAndGet();
    }

    private <T> T rpc(Supplier<T> call) {
        if (!rpcLimiter.acquirePermission()) {
            throw new RpcException("RPC budget exhausted for " + key());
        }
        return call.get();
    }
}
