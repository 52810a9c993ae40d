package com.delangzeta.realtime.ingestion.adapter;

@FunctionalInterface
public interface ChainLogSourceFactory {

    ChainLogSource open(ChainEndpoint endpoint);
}
