package com.delangzeta.realtime.ingestion.config;

import com.delangzeta.realtime.common.RetryPolicy;
import com.delangzeta.realtime.config.AsyncConfig;
import com.delangzeta.realtime.ingestion.adapter.ChainEndpoint;
import com.delangzeta.realtime.ingestion.adapter.ChainLogSourceFactory;
import com.delangzeta.realtime.ingestion.adapter.Web3jChainLogSourceFactory;
import com.delangzeta.realtime.ingestion.connector.ChainConnectorRegistry;
import com.delangzeta.realtime.ingestion.connector.ConnectorDefinition;
import com.delangzeta.realtime.ingestion.connector.ContractEventDecoder;
import com.delangzeta.realtime.ingestion.connector.UniversalContractEvents;
import com.delangzeta.realtime.ingestion.pipeline.EventIngestionPipeline;
import com.delangzeta.realtime.ingestion.store.ChainCursorService;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Wires chain connectors from {@code realtime.ingestion.chains}: one definition per enabled chain with
 * both a WebSocket url and a contract address.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ IngestionProperties.class, IngestionRetryProperties.class })
public class IngestionConfig {

    @Bean
    public RetryPolicy connectorRetryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxDelayMs());
    }

    @Bean
    public ChainLogSourceFactory chainLogSourceFactory() {
        return new Web3jChainLogSourceFactory();
    }

    @Bean
    public ContractEventDecoder contractEventDecoder() {
        return ContractEventDecoder.universalContract();
    }

    @Bean
    public RateLimiterConfig chainRpcRateLimiterConfig(IngestionProperties properties) {
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getRpcPermitTimeoutMs())))
                .build();
    }

    static List<ConnectorDefinition> connectorDefinitions(IngestionProperties properties) {
        List<String> topics = UniversalContractEvents.topics();
        return properties.getChains().entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue().isEnabled())
                .filter(e -> hasText(e.getValue().getWsUrl()) && hasText(e.getValue().getContractAddress()))
                .map(e -> toDefinition(e, topics, properties.getPollingIntervalMs()))
                .toList();
    }

    /**
     * Connectors block their thread for the whole subscription and are never queued, so the pool is sized
     * to the configured connector count with room for restarts.
     */
    @Bean(name = AsyncConfig.CONNECTOR_EXECUTOR)
    public ThreadPoolTaskExecutor connectorExecutor(IngestionProperties properties) {
        int connectors = Math.max(1, connectorDefinitions(properties).size());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.min(4, connectors));
        e.setMaxPoolSize(Math.max(16, connectors * 2));
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("connector-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }

    @Bean
    public ChainConnectorRegistry chainConnectorRegistry(
            IngestionProperties properties,
            ChainLogSourceFactory chainLogSourceFactory,
            ContractEventDecoder contractEventDecoder,
            EventIngestionPipeline pipeline,
            ChainCursorService cursorService,
            RetryPolicy connectorRetryPolicy,
            RateLimiterConfig chainRpcRateLimiterConfig,
            @Qualifier(AsyncConfig.CONNECTOR_EXECUTOR) AsyncTaskExecutor connectorExecutor) {
        return new ChainConnectorRegistry(connectorDefinitions(properties), properties.getReplayBatchBlocks(),
                chainLogSourceFactory, contractEventDecoder, pipeline, cursorService,
                connectorRetryPolicy, chainRpcRateLimiterConfig, connectorExecutor);
    }

    @Bean
    public ConnectorStarter connectorStarter(ChainConnectorRegistry registry, IngestionProperties properties) {
        return new ConnectorStarter(registry, properties.isEnabled());
    }

    private static ConnectorDefinition toDefinition(Map.Entry<String, IngestionProperties.Chain> entry,
                                                    List<String> topics, long pollingIntervalMs) {
        IngestionProperties.Chain chain = entry.getValue();
        ChainEndpoint endpoint = new ChainEndpoint(entry.getKey(), chain.getWsUrl(), chain.getContractAddress(),
                topics, pollingIntervalMs);
        return new ConnectorDefinition(endpoint, chain.getStartBlock());
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    /** Starts every configured connector once the application is ready. */
    public static class ConnectorStarter {

        private final ChainConnectorRegistry registry;
        private final boolean enabled;

        ConnectorStarter(ChainConnectorRegistry registry, boolean enabled) {
            this.registry = registry;
            this.enabled = enabled;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void onApplicationReady() {
            if (!enabled) {
                log.info("Chain ingestion disabled (realtime.ingestion.enabled=false)");
                return;
            }
            registry.startAll();
        }
    }
}
