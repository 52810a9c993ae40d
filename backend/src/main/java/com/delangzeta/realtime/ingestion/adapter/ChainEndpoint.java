package com.delangzeta.realtime.ingestion.adapter;

import java.util.List;

/**
 * What a log source connects to: a WebSocket RPC url, one contract, the topic0 values of interest.
 */
public record ChainEndpoint(
        String chain,
        String wsUrl,
        String contractAddress,
        List<String> eventTopics,
        long pollingIntervalMs
) {
}
