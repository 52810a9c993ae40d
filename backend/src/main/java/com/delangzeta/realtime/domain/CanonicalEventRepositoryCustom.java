package com.delangzeta.realtime.domain;

import java.util.List;

public interface CanonicalEventRepositoryCustom {

    /**
     * Chain-originated events, newest block first (then highest log index). All filters optional.
     */
    List<CanonicalEvent> findChainHistory(String eventName, Long fromBlock, Long toBlock, int limit);

    /**
     * Sets the publish marker.
     *
     * @return false when no event has this id
     */
    boolean markPublished(String id);
}
