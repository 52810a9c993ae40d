package com.delangzeta.realtime.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Locale;

/**
 * Last fully processed log per (chain, contract). Id is {@code <chain>:<contract>}.
 */
@Document(collection = "chain_cursors")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainCursor {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String chain;
    private String contractAddress;
    private long lastProcessedBlock;
    /** -1 when no log of lastProcessedBlock has been processed yet. */
    private long lastLogIndex = -1;
    private Instant updatedAt;

    public static String idOf(String chain, String contractAddress) {
        return chain + ":" + contractAddress.toLowerCase(Locale.ROOT);
    }

    /** True when (block, logIndex) is at or below this watermark. */
    public boolean covers(long block, long logIndex) {
        return block < lastProcessedBlock || (block == lastProcessedBlock && logIndex <= lastLogIndex);
    }
}
