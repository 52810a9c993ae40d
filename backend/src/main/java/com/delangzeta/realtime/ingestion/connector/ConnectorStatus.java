package com.delangzeta.realtime.ingestion.connector;

public record ConnectorStatus(
        String key,
        String chain,
        String contractAddress,
        ConnectorState state,
        Long lastProcessedBlock,
        Long lastLogIndex,
        long processedLogs,
        long reconnects
) {
}
