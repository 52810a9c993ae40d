package com.delangzeta.realtime.sync;

import com.delangzeta.realtime.domain.DeletionLogEntry;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "realtime.sync.page-size=2")
@Testcontainers
class SyncServiceIntegrationTest {

    private static final Instant T0 = Instant.parse("2025-03-01T00:00:00Z");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    SyncService syncService;
    @Autowired
    DeletionLogService deletionLogService;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void seed() {
        for (String c : List.of("tasks", "user_submissions", "validations", "user_profiles")) {
            mongoTemplate.dropCollection(c);
        }
        mongoTemplate.remove(new Query(), DeletionLogEntry.class);
        // collections must exist before the first transactional write
        for (String c : List.of("user_submissions", DeletionLogEntry.COLLECTION)) {
            if (!mongoTemplate.collectionExists(c)) {
                mongoTemplate.createCollection(c);
            }
        }
        mongoTemplate.insert(doc("t1", null, 1), "tasks");
        mongoTemplate.insert(doc("t2", null, 2), "tasks");
        mongoTemplate.insert(doc("t3", null, 2), "tasks");
        mongoTemplate.insert(doc("s1", "alice", 1), "user_submissions");
        mongoTemplate.insert(doc("s2", "bob", 1), "user_submissions");
        mongoTemplate.insert(doc("v1", "alice", 1), "validations");
        mongoTemplate.insert(new Document("_id", "alice").append("userId", "alice").append("isValidator", false)
                .append("updatedAt", Date.from(T0)), "user_profiles");
    }

    @Test
    @DisplayName("user-owned collections only return the caller's rows; role-gated and unknown ones are omitted")
    void accessRules() {
        SyncResult result = syncService.sync("alice", List.of("user_submissions", "validations", "secrets"), null);

        assertThat(result.updates()).extracting(SyncedDocument::id).containsExactly("s1");
        assertThat(result.deletions()).isEmpty();
        assertThat(result.hasMore()).isFalse();
    }

    @Test
    @DisplayName("same inputs and store state give the same result; following timestamps loses nothing")
    void deterministicPaging() {
        SyncResult first = syncService.sync("alice", List.of("tasks"), T0);
        SyncResult again = syncService.sync("alice", List.of("tasks"), T0);

        assertThat(again.updates()).isEqualTo(first.updates());
        assertThat(again.serverTimestamp()).isEqualTo(first.serverTimestamp());
        assertThat(first.hasMore()).isTrue();
        assertThat(first.updates()).extracting(SyncedDocument::id).containsExactly("t1", "t2");
        assertThat(first.serverTimestamp()).isBefore(T0.plusSeconds(2)).isAfterOrEqualTo(T0);

        List<String> seen = new ArrayList<>();
        first.updates().forEach(d -> seen.add(d.id()));
        SyncResult next = syncService.sync("alice", List.of("tasks"), first.serverTimestamp());
        next.updates().forEach(d -> seen.add(d.id()));
        assertThat(seen).contains("t1", "t2", "t3");

        SyncResult resumed = syncService.sync("alice", List.of("tasks"), T0, first.continuationToken());
        assertThat(resumed.updates()).extracting(SyncedDocument::id).containsExactly("t3");
        assertThat(resumed.hasMore()).isFalse();
    }

    @Test
    @DisplayName("more documents than a page sharing one updatedAt are all delivered through the continuation token")
    void pagingThroughOneMillisecond() {
        mongoTemplate.dropCollection("tasks");
        List<String> ids = List.of("t0", "t1", "t2", "t3", "t4");
        ids.forEach(id -> mongoTemplate.insert(doc(id, null, 5), "tasks"));

        SyncResult page = syncService.sync("alice", List.of("tasks"), T0);
        List<String> seen = new ArrayList<>();
        page.updates().forEach(d -> seen.add(d.id()));
        int pulls = 1;
        while (page.hasMore()) {
            assertThat(pulls).as("pull count").isLessThan(ids.size());
            assertThat(page.continuationToken()).isNotNull();
            assertThat(page.serverTimestamp()).isAfterOrEqualTo(T0);
            page = syncService.sync("alice", List.of("tasks"), T0, page.continuationToken());
            page.updates().forEach(d -> seen.add(d.id()));
            pulls++;
        }

        assertThat(seen).containsExactlyElementsOf(ids);
        assertThat(pulls).isEqualTo(3);
        assertThat(page.continuationToken()).isNull();
        assertThat(page.serverTimestamp()).isAfter(T0.plusSeconds(5));
    }

    @Test
    @DisplayName("tombstones are capped at the page size and resumed through the continuation token")
    void deletionsArePaged() {
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            mongoTemplate.insert(doc("d" + i, "alice", 1), "user_submissions");
            assertThat(deletionLogService.delete("user_submissions", "d" + i, "alice")).isTrue();
            expected.add("user_submissions/d" + i);
        }

        SyncResult page = syncService.sync("alice", List.of("user_submissions"), T0);
        assertThat(page.deletions()).hasSize(2);
        assertThat(page.hasMore()).isTrue();
        assertThat(page.serverTimestamp()).isAfterOrEqualTo(T0);

        List<String> seen = new ArrayList<>(page.deletions());
        while (page.hasMore()) {
            page = syncService.sync("alice", List.of("user_submissions"), T0, page.continuationToken());
            assertThat(page.deletions()).hasSizeLessThanOrEqualTo(2);
            seen.addAll(page.deletions());
        }

        assertThat(seen).containsExactlyElementsOf(expected);
    }

    @Test
    @DisplayName("a token this service did not issue is rejected")
    void foreignTokenRejected() {
        assertThatThrownBy(() -> syncService.sync("alice", List.of("tasks"), T0, "bm90LWEtY3Vyc29y"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("deleted documents show up as <collection>/<id> once a since timestamp is given")
    void deletionsReported() {
        assertThat(deletionLogService.delete("user_submissions", "s1", "alice")).isTrue();
        assertThat(deletionLogService.delete("user_submissions", "missing", "alice")).isFalse();

        SyncResult result = syncService.sync("alice", List.of("user_submissions"), T0);

        assertThat(result.deletions()).containsExactly("user_submissions/s1");
        assertThat(result.updates()).isEmpty();
        assertThat(syncService.sync("alice", List.of("user_submissions"), null).deletions()).isEmpty();
    }

    @Test
    @DisplayName("no truncation: server timestamp is now and never below since")
    void timestampNotBelowSince() {
        Instant future = Instant.now().plusSeconds(3600);

        SyncResult result = syncService.sync("alice", List.of("tasks"), future);

        assertThat(result.updates()).isEmpty();
        assertThat(result.serverTimestamp()).isEqualTo(future);
    }

    private static Document doc(String id, String userId, long secondsAfterT0) {
        Document d = new Document("_id", id).append("updatedAt", Date.from(T0.plusSeconds(secondsAfterT0)));
        if (userId != null) {
            d.append("userId", userId);
        }
        return d;
    }
}
