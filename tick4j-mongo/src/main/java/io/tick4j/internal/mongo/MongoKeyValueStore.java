package io.tick4j.internal.mongo;

import io.tick4j.spi.KeyValueStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB {@link KeyValueStore}, one document per tenant key.
 */
public class MongoKeyValueStore implements KeyValueStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoKeyValueStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<String> get(String tenantId, String key) {
        Query query = new Query(Criteria.where("_id").is(CacheEntryDocument.idOf(tenantId, key))
                .and("expireAt").gt(clock.instant()));
        CacheEntryDocument doc = mongoTemplate.findOne(query, CacheEntryDocument.class);
        return doc == null ? Optional.empty() : Optional.ofNullable(doc.getValue());
    }

    @Override
    public void put(String tenantId, String key, String value, Duration ttl) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }

        Instant expireAt = clock.instant().plus(ttl);
        Update update = new Update()
                .set("tenantId", tenantId)
                .set("key", key)
                .set("value", value)
                .set("expireAt", expireAt);
        mongoTemplate.upsert(byId(tenantId, key), update, CacheEntryDocument.class);
    }

    @Override
    public void remove(String tenantId, String key) {
        mongoTemplate.remove(byId(tenantId, key), CacheEntryDocument.class);
    }

    @Override
    public void removeAll(String tenantId, Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        Query query = new Query(Criteria.where("tenantId").is(tenantId).and("key").in(keys));
        mongoTemplate.remove(query, CacheEntryDocument.class);
    }

    private static Query byId(String tenantId, String key) {
        return new Query(Criteria.where("_id").is(CacheEntryDocument.idOf(tenantId, key)));
    }
}
