package com.delangzeta.realtime.ingestion.connector;

import com.delangzeta.realtime.common.RetryPolicy;
import com.delangzeta.realtime.domain.ChainCursor;
import com.delangzeta.realtime.ingestion.adapter.ChainEndpoint;
import com.delangzeta.realtime.ingestion.adapter.ChainLogSource;
import com.delangzeta.realtime.ingestion.adapter.RawLog;
import com.delangzeta.realtime.ingestion.pipeline.EventIngestionPipeline;
import com.delangzeta.realtime.ingestion.store.ChainCursorService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainConnectorTest {

    private static final String RECIPIENT = "0x2222222222222222222222222222222222222222";
    private static final String TOKEN = "0x3333333333333333333333333333333333333333";

    @Mock
    EventIngestionPipeline pipeline;
    @Mock
    ChainCursorService cursorService;

    private FakeLogSource source;
    private ChainConnector connector;

    @BeforeEach
    void setUp() {
        source = new FakeLogSource();
        ChainEndpoint endpoint = new ChainEndpoint("zetachain", "ws://node", ContractLogs.CONTRACT, List.of(), 1000);
        connector = new ChainConnector(new ConnectorDefinition(endpoint, 100L), 10, e -> source,
                ContractEventDecoder.universalContract(), pipeline, cursorService,
                RetryPolicy.defaultPolicy(), RateLimiter.ofDefaults("test-rpc"));
        lenient().when(cursorService.advance(eq("zetachain"), eq(ContractLogs.CONTRACT), anyLong(), anyLong()))
                .thenAnswer(inv -> cursor(inv.getArgument(2), inv.getArgument(3)));
        connector.markStarting();
    }

    @Test
    @DisplayName("replay walks [startBlock, head] in batches and ingests in block/logIndex order")
    void replayFromStartBlockInOrder() {
        when(cursorService.find("zetachain", ContractLogs.CONTRACT)).thenReturn(Optional.empty());
        source.head = 125;
        source.logs.add(ContractLogs.rewardDistributed(RECIPIENT, 2, TOKEN, 112, 1));
        source.logs.add(ContractLogs.rewardDistributed(RECIPIENT, 1, TOKEN, 112, 0));
        source.logs.add(ContractLogs.rewardDistributed(RECIPIENT, 3, TOKEN, 121, 0));

        connector.replay(source);

        assertThat(source.ranges).containsExactly("100-109", "110-119", "120-125");
        ArgumentCaptor<DecodedLog> captor = ArgumentCaptor.forClass(DecodedLog.class);
        verify(pipeline, times(3)).ingest(captor.capture());
        assertThat(captor.getAllValues()).extracting(d -> d.blockNumber() + "#" + d.logIndex())
                .containsExactly("112#0", "112#1", "121#0");
        assertThat(connector.status().lastProcessedBlock()).isEqualTo(121L);
    }

    @Test
    @DisplayName("blocks below the cursor are never re-ingested")
    void skipsBlocksBelowCursor() {
        when(cursorService.find("zetachain", ContractLogs.CONTRACT)).thenReturn(Optional.of(cursor(112, 0)));
        source.head = 113;
        source.logs.add(ContractLogs.rewardDistributed(RECIPIENT, 1, TOKEN, 111, 4));
        source.logs.add(ContractLogs.rewardDistributed(RECIPIENT, 2, TOKEN, 113, 0));

        connector.replay(source);

        assertThat(source.ranges).containsExactly("112-113");
        ArgumentCaptor<DecodedLog> captor = ArgumentCaptor.forClass(DecodedLog.class);
        verify(pipeline).ingest(captor.capture());
        assertThat(captor.getValue().blockNumber()).isEqualTo(113);
    }

    @Test
    @DisplayName("a log arriving after a later log of the same block is still ingested")
    void outOfOrderLogInCursorBlockIngested() {
        when(cursorService.find("zetachain", ContractLogs.CONTRACT)).thenReturn(Optional.empty());
        when(pipeline.ingest(any())).thenReturn(1);
        source.head = 99;
        connector.replay(source);

        connector.handle(ContractLogs.rewardDistributed(RECIPIENT, 2, TOKEN, 112, 5));
        connector.handle(ContractLogs.rewardDistributed(RECIPIENT, 1, TOKEN, 112, 3));

        ArgumentCaptor<DecodedLog> captor = ArgumentCaptor.forClass(DecodedLog.class);
        verify(pipeline, times(2)).ingest(captor.capture());
        assertThat(captor.getAllValues()).extracting(d -> d.blockNumber() + "#" + d.logIndex())
                .containsExactly("112#5", "112#3");
        assertThat(connector.status().lastProcessedBlock()).isEqualTo(112L);
        verify(cursorService).advance("zetachain", ContractLogs.CONTRACT, 112L, 3L);
    }

    @Test
    @DisplayName("a malformed log is skipped without advancing the cursor or stopping the batch")
    void malformedLogSkipped() {
        when(cursorService.find("zetachain", ContractLogs.CONTRACT)).thenReturn(Optional.empty());
        RawLog good = ContractLogs.rewardDistributed(RECIPIENT, 1, TOKEN, 101, 1);
        source.head = 101;
        source.logs.add(new RawLog(ContractLogs.CONTRACT, List.of("0xdeadbeef"), "0x", 101L, "0xbad", 0L, false));
        source.logs.add(good);

        connector.replay(source);

        verify(pipeline, times(1)).ingest(any());
        verify(cursorService, never()).advance(any(), any(), eq(101L), eq(0L));
        verify(cursorService).advance("zetachain", ContractLogs.CONTRACT, 101L, 1L);
    }

    @Test
    @DisplayName("without cursor or start block the connector follows from head")
    void noCursorNoStartBlockFollowsHead() {
        ChainEndpoint endpoint = new ChainEndpoint("bsc", "ws://node", ContractLogs.CONTRACT, List.of(), 1000);
        ChainConnector fromHead = new ChainConnector(new ConnectorDefinition(endpoint, null), 10, e -> source,
                ContractEventDecoder.universalContract(), pipeline, cursorService,
                RetryPolicy.defaultPolicy(), RateLimiter.ofDefaults("test-rpc-2"));
        when(cursorService.find("bsc", ContractLogs.CONTRACT)).thenReturn(Optional.empty());
        source.head = 500;

        fromHead.replay(source);

        assertThat(source.ranges).isEmpty();
        verify(pipeline, never()).ingest(any());
    }

    private static ChainCursor cursor(long block, long logIndex) {
        ChainCursor c = new ChainCursor();
        c.setId(ChainCursor.idOf("zetachain", ContractLogs.CONTRACT));
        c.setChain("zetachain");
        c.setContractAddress(ContractLogs.CONTRACT);
        c.setLastProcessedBlock(block);
        c.setLastLogIndex(logIndex);
        return c;
    }

    static class FakeLogSource implements ChainLogSource {

        long head;
        final List<RawLog> logs = new ArrayList<>();
        final List<String> ranges = new ArrayList<>();

        @Override
        public void connect() {
        }

        @Override
        public long headBlock() {
            return head;
        }

        @Override
        public List<RawLog> getLogs(long fromBlock, long toBlock) {
            ranges.add(fromBlock + "-" + toBlock);
            return logs.stream()
                    .filter(l -> l.blockNumber() >= fromBlock && l.blockNumber() <= toBlock)
                    .toList();
        }

        @Override
        public Flux<RawLog> logs() {
            return Flux.never();
        }

        @Override
        public void close() {
        }
    }
}
