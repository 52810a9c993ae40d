package com.delangzeta.realtime.ingestion.connector;

public enum ConnectorState {
    STARTING,
    REPLAYING,
    LIVE,
    BACKOFF,
    STOPPED
}
