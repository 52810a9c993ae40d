package com.delangzeta.realtime.ingestion.adapter;

import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.websocket.WebSocketService;
import org.web3j.utils.Numeric;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.math.BigInteger;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * web3j over a WebSocket transport. Range queries use eth_getLogs; the live stream is web3j's log
 * flowable for the contract and topic set.
 */
@Slf4j
public class Web3jChainLogSource implements ChainLogSource {

    private final ChainEndpoint endpoint;
    private WebSocketService webSocketService;
    private ScheduledExecutorService pollExecutor;
    private Web3j web3j;

    public Web3jChainLogSource(ChainEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public void connect() {
        webSocketService = new WebSocketService(endpoint.wsUrl(), false);
        try {
            webSocketService.connect();
        } catch (ConnectException e) {
            throw new RpcException("Cannot connect to " + endpoint.chain() + " node", e);
        }
        pollExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "web3j-" + endpoint.chain());
            t.setDaemon(true);
            return t;
        });
        web3j = Web3j.build(webSocketService, endpoint.pollingIntervalMs(), pollExecutor);
        log.info("Connected to {} for contract {}", endpoint.chain(), endpoint.contractAddress());
    }

    @Override
    public long headBlock() {
        try {
            EthBlockNumber response = requireConnected().ethBlockNumber().send();
            if (response.hasError()) {
                throw new RpcException("eth_blockNumber failed on " + endpoint.chain() + ": " + response.getError().getMessage());
            }
            return response.getBlockNumber().longValueExact();
        } catch (IOException e) {
            throw new RpcException("eth_blockNumber failed on " + endpoint.chain(), e);
        }
    }

    @Override
    public List<RawLog> getLogs(long fromBlock, long toBlock) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
                endpoint.contractAddress());
        filter.addOptionalTopics(endpoint.eventTopics().toArray(new String[0]));
        try {
            EthLog response = requireConnected().ethGetLogs(filter).send();
            if (response.hasError()) {
                throw new RpcException("eth_getLogs [" + fromBlock + ", " + toBlock + "] failed on "
                        + endpoint.chain() + ": " + response.getError().getMessage());
            }
            List<RawLog> logs = new ArrayList<>();
            for (EthLog.LogResult<?> result : response.getLogs()) {
                if (result.get() instanceof Log entry) {
                    logs.add(toRawLog(entry));
                }
            }
            return logs;
        } catch (IOException e) {
            throw new RpcException("eth_getLogs [" + fromBlock + ", " + toBlock + "] failed on " + endpoint.chain(), e);
        }
    }

    @Override
    public Flux<RawLog> logs() {
        EthFilter filter = new EthFilter(DefaultBlockParameterName.LATEST, DefaultBlockParameterName.LATEST,
                endpoint.contractAddress());
        filter.addOptionalTopics(endpoint.eventTopics().toArray(new String[0]));
        return Flux.from(requireConnected().ethLogFlowable(filter))
                .map(Web3jChainLogSource::toRawLog);
    }

    @Override
    public void close() {
        if (web3j != null) {
            web3j.shutdown();
        } else if (webSocketService != null) {
            webSocketService.close();
        }
        if (pollExecutor != null) {
            pollExecutor.shutdownNow();
        }
        web3j = null;
    }

    private Web3j requireConnected() {
        if (web3j == null) {
            throw new RpcException("Log source for " + endpoint.chain() + " is not connected");
        }
        return web3j;
    }

    static RawLog toRawLog(Log entry) {
        return new RawLog(
                entry.getAddress(),
                entry.getTopics(),
                entry.getData(),
                quantity(entry.getBlockNumberRaw()),
                entry.getTransactionHash(),
                quantity(entry.getLogIndexRaw()),
                entry.isRemoved());
    }

    private static Long quantity(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return Numeric.decodeQuantity(raw).longValueExact();
    }
}
