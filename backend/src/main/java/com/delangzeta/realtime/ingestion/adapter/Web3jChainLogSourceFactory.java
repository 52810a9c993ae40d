package com.delangzeta.realtime.ingestion.adapter;

public class Web3jChainLogSourceFactory implements ChainLogSourceFactory {

    @Override
    public ChainLogSource open(ChainEndpoint endpoint) {
        return new Web3jChainLogSource(endpoint);
    }
}
