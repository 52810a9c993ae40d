package com.delangzeta.realtime.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chain connectors. Keys of {@code chains} are the chain names used in event ids (ethereum, zetachain, bsc, polygon).
 */
@ConfigurationProperties(prefix = "realtime.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionProperties {

    /** Start connectors when the application is ready. Default true. */
    private boolean enabled = true;

    /** Block span of one eth_getLogs call during replay. Default 2000. */
    private int replayBatchBlocks = 2000;

    /** RPC budget per connector (replay calls). Default 25. */
    private int maxRequestsPerSecond = 25;

    /** How long a replay call may wait for an RPC permit before the session fails. Default 5000. */
    private long rpcPermitTimeoutMs = 5000L;

    /** web3j filter polling interval for the live stream. Default 2000. */
    private long pollingIntervalMs = 2000L;

    private Map<String, Chain> chains = new LinkedHashMap<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Chain {

        private boolean enabled = true;
        private String wsUrl;
        private String contractAddress;
        /** First block to replay when no cursor exists; empty means start at head. */
        private Long startBlock;
    }
}
