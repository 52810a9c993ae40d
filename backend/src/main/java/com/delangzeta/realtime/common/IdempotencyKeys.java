package com.delangzeta.realtime.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Deterministic event ids. Chain logs keep a readable composite key; everything else is a sha-256 of its parts.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    /** {@code <chain>:<txHash>:<logIndex>} with the hash lower-cased. */
    public static String chainLog(String chain, String transactionHash, long logIndex) {
        if (chain == null || transactionHash == null) {
            throw new IllegalArgumentException("chain and transactionHash are required");
        }
        return chain + ":" + transactionHash.toLowerCase(Locale.ROOT) + ":" + logIndex;
    }

    /** Hex sha-256 of the parts joined with ':'. Null parts are rendered as empty strings. */
    public static String contentHash(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(':');
            }
            if (parts[i] != null) {
                sb.append(parts[i]);
            }
        }
        return HexFormat.of().formatHex(sha256(sb.toString().getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
