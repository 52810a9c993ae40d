package com.delangzeta.realtime.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Push device token. Id is {@code <userId>_<token>}; unregistering only flips {@code active}.
 */
@Document(collection = "user_device_tokens")
@CompoundIndex(name = "user_active", def = "{'userId': 1, 'active': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DeviceToken {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String token;
    private Map<String, Object> deviceInfo;
    private boolean active;
    private Instant registeredAt;
    private Instant lastUsed;
    private Instant unregisteredAt;

    public static String idOf(String userId, String token) {
        return userId + "_" + token;
    }
}
