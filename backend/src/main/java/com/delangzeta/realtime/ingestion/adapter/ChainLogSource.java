package com.delangzeta.realtime.ingestion.adapter;

import reactor.core.publisher.Flux;

import java.util.List;

/**
 * One connection to one chain for one contract. Not reusable after {@link #close()}; connectors open
 * a fresh source on every reconnect.
 */
public interface ChainLogSource extends AutoCloseable {

    /**
     * Opens the transport. Throws {@link RpcException} when the node cannot be reached.
     */
    void connect();

    long headBlock();

    /**
     * Logs of the endpoint's contract and topics in [fromBlock, toBlock], inclusive.
     */
    List<RawLog> getLogs(long fromBlock, long toBlock);

    /**
     * Live logs from the current head onward. Completes or errors when the connection is lost.
     */
    Flux<RawLog> logs();

    @Override
    void close();
}
