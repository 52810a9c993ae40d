package com.delangzeta.realtime.ingestion.connector;

/**
 * Log that cannot be turned into a typed event: unknown topic, undecodable data, missing coordinates,
 * or removed by a reorg. The connector logs and skips it.
 */
public class MalformedLogException extends RuntimeException {

    public MalformedLogException(String message) {
        super(message);
    }

    public MalformedLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
