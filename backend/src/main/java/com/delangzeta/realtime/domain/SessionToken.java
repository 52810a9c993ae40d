package com.delangzeta.realtime.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Opaque session issued by the wallet-signature login flow. Read-only in this service.
 */
@Document(collection = "auth_sessions")
@NoArgsConstructor
@Getter
@Setter
public class SessionToken {

    @Id
    private String token;
    private String userId;
    private String walletAddress;
    private List<String> permissions;
    private Instant expiresAt;
}
