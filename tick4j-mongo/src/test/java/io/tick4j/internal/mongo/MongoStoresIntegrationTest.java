package io.tick4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.tick4j.breaker.CircuitBreakerState;
import io.tick4j.cache.CacheItemInfo;
import io.tick4j.cache.CacheMetadata;
import io.tick4j.scheduler.FeatureToggles;
import io.tick4j.scheduler.JobMarkers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoTenantStateStore stateStore;
    private MongoKeyValueStore keyValueStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "tick4j_test");
        dropCollections();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        stateStore = new MongoTenantStateStore(mongoTemplate, new ObjectMapper(), clock);
        keyValueStore = new MongoKeyValueStore(mongoTemplate, clock);
    }

    @AfterEach
    void tearDown() {
        dropCollections();
    }

    private void dropCollections() {
        mongoTemplate.dropCollection(TenantStateDocument.class);
        mongoTemplate.dropCollection(CacheEntryDocument.class);
    }

    @Test
    void missingSectionShouldReadAsInitialValue() {
        assertThat(stateStore.read("tenant-a", CircuitBreakerState.SECTION)).isEqualTo(CircuitBreakerState.closed());
        assertThat(stateStore.tenantIds()).isEmpty();
    }

    @Test
    void sectionsShouldRoundTripWithInstants() {
        CircuitBreakerState open = new CircuitBreakerState(5, NOW, true);

        stateStore.update("tenant-a", CircuitBreakerState.SECTION, s -> open);
        stateStore.update("tenant-a", JobMarkers.SECTION, m -> m.with("digest", "2026-03-02", NOW));

        assertThat(stateStore.read("tenant-a", CircuitBreakerState.SECTION)).isEqualTo(open);
        assertThat(stateStore.read("tenant-a", JobMarkers.SECTION).valueOf("digest")).isEqualTo("2026-03-02");
    }

    @Test
    void sectionUpdatesShouldNotOverwriteEachOther() {
        stateStore.update("tenant-a", FeatureToggles.SECTION, t -> t.with("digest"));
        stateStore.update("tenant-a", CacheMetadata.SECTION,
                m -> m.with(new CacheItemInfo("thread.summary:42", 120, NOW, "summary")));
        stateStore.update("tenant-b", FeatureToggles.SECTION, t -> t.with("autoLabel"));

        assertThat(stateStore.read("tenant-a", FeatureToggles.SECTION).contains("digest")).isTrue();
        CacheMetadata meta = stateStore.read("tenant-a", CacheMetadata.SECTION);
        assertThat(meta.count()).isEqualTo(1);
        assertThat(meta.totalSize()).isEqualTo(120);
        assertThat(stateStore.tenantIds()).containsExactlyInAnyOrder("tenant-a", "tenant-b");
    }

    @Test
    void keyValueStoreShouldHonorExpiry() {
        keyValueStore.put("tenant-a", "fresh", "v1", Duration.ofMinutes(5));
        mongoTemplate.upsert(
                new Query(Criteria.where("_id").is("tenant-a:expired")),
                new Update()
                        .set("tenantId", "tenant-a")
                        .set("key", "expired")
                        .set("value", "old")
                        .set("expireAt", NOW.minusSeconds(1)),
                CacheEntryDocument.class);

        assertThat(keyValueStore.get("tenant-a", "fresh")).contains("v1");
        assertThat(keyValueStore.get("tenant-a", "expired")).isEmpty();
        assertThat(keyValueStore.get("tenant-b", "fresh")).isEmpty();
    }

    @Test
    void removeAllShouldOnlyTouchTheTenant() {
        keyValueStore.put("tenant-a", "k1", "a1", Duration.ofMinutes(5));
        keyValueStore.put("tenant-a", "k2", "a2", Duration.ofMinutes(5));
        keyValueStore.put("tenant-b", "k1", "b1", Duration.ofMinutes(5));

        keyValueStore.removeAll("tenant-a", List.of("k1", "k2"));

        assertThat(keyValueStore.get("tenant-a", "k1")).isEmpty();
        assertThat(keyValueStore.get("tenant-a", "k2")).isEmpty();
        assertThat(keyValueStore.get("tenant-b", "k1")).contains("b1");
    }
}
