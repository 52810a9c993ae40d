package com.delangzeta.realtime.ingestion.adapter;

import java.util.List;

/**
 * Contract log as delivered by the node, before ABI decoding. Block number and log index are null
 * for pending logs.
 */
public record RawLog(
        String contractAddress,
        List<String> topics,
        String data,
        Long blockNumber,
        String transactionHash,
        Long logIndex,
        boolean removed
) {

    public String topic0() {
        return topics == null || topics.isEmpty() ? null : topics.get(0);
    }
}
