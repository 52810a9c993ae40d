package com.delangzeta.realtime.ratelimit;

import com.delangzeta.realtime.domain.RateLimitCounter;
import com.delangzeta.realtime.domain.RateLimitScope;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.bson.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers
class MongoRateLimitStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    static MongoClient client;
    static MongoTemplate mongoTemplate;

    MongoRateLimitStore store;

    @BeforeAll
    static void connect() {
        client = MongoClients.create(mongo.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(client, "ratelimit_test");
    }

    @AfterAll
    static void disconnect() {
        client.close();
    }

    @BeforeEach
    void clean() {
        mongoTemplate.dropCollection(RateLimitCounter.COLLECTION);
        store = new MongoRateLimitStore(mongoTemplate);
    }

    @Test
    @DisplayName("concurrent first requests on a new key: exactly limit allowed, one counter document")
    void concurrentUpsertsAreLinearizable() throws Exception {
        int requests = 40;
        int limit = 15;
        ExecutorService pool = Executors.newFixedThreadPool(12);
        List<Callable<Boolean>> calls = new ArrayList<>();
        for (int i = 0; i < requests; i++) {
            calls.add(() -> store.checkAndConsume(RateLimitScope.IP, "1.2.3.4", limit, 60_000, 5_000).allowed());
        }
        long allowed = 0;
        for (Future<Boolean> f : pool.invokeAll(calls)) {
            if (f.get()) {
                allowed++;
            }
        }
        pool.shutdown();

        assertThat(allowed).isEqualTo(limit);
        Document counter = mongoTemplate.findById("ip_1.2.3.4", Document.class, RateLimitCounter.COLLECTION);
        assertThat(counter).isNotNull();
        assertThat(((Number) counter.get("count")).intValue()).isEqualTo(limit);
        assertThat(((Number) counter.get("windowEnd")).longValue()).isEqualTo(65_000L);
    }

    @Test
    @DisplayName("rejections leave the count alone; an ended window restarts at 1")
    void rejectionThenReset() {
        assertThat(store.checkAndConsume(RateLimitScope.USER, "u1", 1, 1000, 0).allowed()).isTrue();
        RateLimitDecision rejected = store.checkAndConsume(RateLimitScope.USER, "u1", 1, 1000, 500);
        assertThat(rejected.allowed()).isFalse();
        assertThat(rejected.resetTime()).isEqualTo(1000);

        RateLimitDecision fresh = store.checkAndConsume(RateLimitScope.USER, "u1", 1, 1000, 1000);
        assertThat(fresh.allowed()).isTrue();
        assertThat(fresh.remaining()).isZero();
        assertThat(fresh.resetTime()).isEqualTo(2000);
    }

    @Test
    @DisplayName("janitor deletion removes ended counters only")
    void deleteExpired() {
        store.checkAndConsume(RateLimitScope.IP, "old", 10, 100, 0);
        store.checkAndConsume(RateLimitScope.IP, "current", 10, 100_000, 0);

        assertThat(store.deleteExpired(1_000, 100)).isEqualTo(1);
        assertThat(mongoTemplate.findById("ip_current", Document.class, RateLimitCounter.COLLECTION)).isNotNull();
        assertThat(mongoTemplate.findById("ip_old", Document.class, RateLimitCounter.COLLECTION)).isNull();
    }
}
