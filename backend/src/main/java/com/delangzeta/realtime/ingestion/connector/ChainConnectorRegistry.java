package com.delangzeta.realtime.ingestion.connector;

import com.delangzeta.realtime.common.RetryPolicy;
import com.delangzeta.realtime.ingestion.adapter.ChainLogSourceFactory;
import com.delangzeta.realtime.ingestion.pipeline.EventIngestionPipeline;
import com.delangzeta.realtime.ingestion.store.ChainCursorService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Owns one supervised connector task per {@code <chain>:<contract>}. A connector recovers from its own
 * session failures; the registry only starts, stops and restarts whole tasks.
 */
@Slf4j
public class ChainConnectorRegistry {

    private final Map<String, ConnectorDefinition> definitions;
    private final int replayBatchBlocks;
    private final ChainLogSourceFactory sourceFactory;
    private final ContractEventDecoder decoder;
    private final EventIngestionPipeline pipeline;
    private final ChainCursorService cursorService;
    private final RetryPolicy reconnectPolicy;
    private final RateLimiterConfig rpcLimiterConfig;
    private final AsyncTaskExecutor executor;

    private final Map<String, ChainConnector> connectors = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> tasks = new ConcurrentHashMap<>();

    public ChainConnectorRegistry(List<ConnectorDefinition> definitions, int replayBatchBlocks,
                                  ChainLogSourceFactory sourceFactory, ContractEventDecoder decoder,
                                  EventIngestionPipeline pipeline, ChainCursorService cursorService,
                                  RetryPolicy reconnectPolicy, RateLimiterConfig rpcLimiterConfig,
                                  AsyncTaskExecutor executor) {
        this.definitions = new LinkedHashMap<>();
        definitions.forEach(d -> this.definitions.put(d.key(), d));
        this.replayBatchBlocks = replayBatchBlocks;
        this.sourceFactory = sourceFactory;
        this.decoder = decoder;
        this.pipeline = pipeline;
        this.cursorService = cursorService;
        this.reconnectPolicy = reconnectPolicy;
        this.rpcLimiterConfig = rpcLimiterConfig;
        this.executor = executor;
    }

    public List<String> keys() {
        return new ArrayList<>(definitions.keySet());
    }

    public void startAll() {
        log.info("Starting {} chain connectors", definitions.size());
        for (String key : definitions.keySet()) {
            try {
                start(key);
            } catch (TaskRejectedException e) {
                log.error("Connector {} could not be scheduled; the others keep starting", key, e);
            }
        }
    }

    /**
     * Starts the connector unless it is already running.
     *
     * @throws IllegalArgumentException for an unknown key
     * @throws TaskRejectedException when the executor has no thread left for it
     */
    public synchronized void start(String key) {
        ConnectorDefinition definition = definitions.get(key);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown connector: " + key);
        }
        ChainConnector existing = connectors.get(key);
        if (existing != null && existing.isRunning()) {
            log.debug("Connector {} already running", key);
            return;
        }
        ChainConnector connector = new ChainConnector(definition, replayBatchBlocks, sourceFactory, decoder,
                pipeline, cursorService, reconnectPolicy, RateLimiter.of("rpc-" + key, rpcLimiterConfig));
        connector.markStarting();
        connectors.put(key, connector);
        try {
            tasks.put(key, executor.submit(connector));
        } catch (TaskRejectedException e) {
            connectors.remove(key);
            throw e;
        }
    }

    /**
     * @return true when a connector was running under this key
     */
    public synchronized boolean stop(String key) {
        ChainConnector connector = connectors.remove(key);
        Future<?> task = tasks.remove(key);
        if (connector == null) {
            return false;
        }
        connector.stop();
        if (task != null) {
            task.cancel(true);
        }
        log.info("Connector {} stop requested", key);
        return true;
    }

    public synchronized void restart(String key) {
        stop(key);
        start(key);
    }

    @PreDestroy
    public synchronized void stopAll() {
        new ArrayList<>(connectors.keySet()).forEach(this::stop);
    }

    public List<ConnectorStatus> status() {
        return connectors.values().stream()
                .map(ChainConnector::status)
                .sorted(Comparator.comparing(ConnectorStatus::key))
                .toList();
    }
}
