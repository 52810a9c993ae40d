package com.delangzeta.realtime.ingestion.connector;

import com.delangzeta.realtime.domain.ChainCursor;
import com.delangzeta.realtime.ingestion.adapter.ChainEndpoint;

/**
 * Static configuration of one connector. {@code startBlock} applies only when no cursor exists yet;
 * null means "from the current head".
 */
public record ConnectorDefinition(ChainEndpoint endpoint, Long startBlock) {

    public String key() {
        return ChainCursor.idOf(endpoint.chain(), endpoint.contractAddress());
    }
}
