package com.delangzeta.realtime.ingestion.connector;

import java.util.Map;

/**
 * ABI-decoded contract log. Field values are String (addresses, uint256 as decimal, bytes32 and
 * indexed strings as 0x hex) or Boolean.
 */
public record DecodedLog(
        String chain,
        String contractAddress,
        String eventName,
        long blockNumber,
        String transactionHash,
        long logIndex,
        Map<String, Object> fields
) {

    public String field(String name) {
        Object value = fields.get(name);
        return value == null ? null : value.toString();
    }
}
