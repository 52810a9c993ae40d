package com.delangzeta.realtime.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Fixed-window counter in rate_limits. Window bounds are epoch millis.
 * Only MongoRateLimitStore writes it, always with a single findOneAndUpdate.
 */
@Document(collection = RateLimitCounter.COLLECTION)
@NoArgsConstructor
@Getter
@Setter
public class RateLimitCounter {

    public static final String COLLECTION = "rate_limits";

    @Id
    private String id;
    private RateLimitScope scope;
    private String identifier;
    private int count;
    private long windowStart;
    @Indexed(name = "windowEnd_idx")
    private long windowEnd;
    private long lastRequest;
}
