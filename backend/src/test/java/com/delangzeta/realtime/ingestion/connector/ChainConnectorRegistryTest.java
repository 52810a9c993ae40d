package com.delangzeta.realtime.ingestion.connector;

import com.delangzeta.realtime.common.RetryPolicy;
import com.delangzeta.realtime.ingestion.adapter.ChainEndpoint;
import com.delangzeta.realtime.ingestion.adapter.ChainLogSourceFactory;
import com.delangzeta.realtime.ingestion.pipeline.EventIngestionPipeline;
import com.delangzeta.realtime.ingestion.store.ChainCursorService;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.List;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainConnectorRegistryTest {

    @Mock
    AsyncTaskExecutor executor;
    @Mock
    Future<Object> task;
    @Mock
    ChainLogSourceFactory sourceFactory;
    @Mock
    EventIngestionPipeline pipeline;
    @Mock
    ChainCursorService cursorService;

    private ChainConnectorRegistry registry;

    @BeforeEach
    void setUp() {
        List<ConnectorDefinition> definitions = List.of(
                new ConnectorDefinition(new ChainEndpoint("zetachain", "ws://a", "0xAAA", List.of(), 1000), null),
                new ConnectorDefinition(new ChainEndpoint("bsc", "ws://b", "0xBBB", List.of(), 1000), 5L));
        registry = new ChainConnectorRegistry(definitions, 100, sourceFactory, ContractEventDecoder.universalContract(),
                pipeline, cursorService, RetryPolicy.defaultPolicy(), RateLimiterConfig.ofDefaults(), executor);
    }

    @Test
    @DisplayName("one task per (chain, contract); starting a running connector is a no-op")
    void startIsIdempotentPerKey() {
        doSubmitReturnsTask();

        registry.startAll();
        registry.start("zetachain:0xaaa");

        verify(executor, times(2)).submit(any(Runnable.class));
        assertThat(registry.keys()).containsExactly("zetachain:0xaaa", "bsc:0xbbb");
        assertThat(registry.status()).extracting(ConnectorStatus::key).containsExactly("bsc:0xbbb", "zetachain:0xaaa");
        assertThat(registry.status()).allSatisfy(s -> assertThat(s.state()).isEqualTo(ConnectorState.STARTING));
    }

    @Test
    @DisplayName("stop cancels the task; restart schedules a fresh connector")
    void stopAndRestart() {
        doSubmitReturnsTask();
        registry.start("bsc:0xbbb");

        assertThat(registry.stop("bsc:0xbbb")).isTrue();
        assertThat(registry.stop("bsc:0xbbb")).isFalse();
        verify(task).cancel(true);
        assertThat(registry.status()).isEmpty();

        registry.restart("bsc:0xbbb");
        verify(executor, times(2)).submit(any(Runnable.class));
    }

    @Test
    @DisplayName("a connector the executor rejects is not registered and does not stop the others")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void rejectedConnectorDoesNotAbortStartAll() {
        when(executor.submit(any(Runnable.class)))
                .thenThrow(new TaskRejectedException("connector pool exhausted"))
                .thenReturn((Future) task);

        registry.startAll();

        verify(executor, times(2)).submit(any(Runnable.class));
        assertThat(registry.status()).extracting(ConnectorStatus::key).containsExactly("bsc:0xbbb");

        registry.start("zetachain:0xaaa");
        assertThat(registry.status()).extracting(ConnectorStatus::key).containsExactly("bsc:0xbbb", "zetachain:0xaaa");
    }

    @Test
    void unknownKeyRejected() {
        assertThatThrownBy(() -> registry.start("polygon:0x1")).isInstanceOf(IllegalArgumentException.class);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void doSubmitReturnsTask() {
        when(executor.submit(any(Runnable.class))).thenReturn((Future) task);
    }
}
