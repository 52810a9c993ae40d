package com.delangzeta.realtime.ingestion.adapter;

/**
 * RPC transport or node-side failure. Connectors treat it as transient and reconnect with backoff.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
