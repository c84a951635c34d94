package io.tick4j.config;

import io.tick4j.internal.mongo.CacheEntryDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.time.Duration;

/**
 * MongoDB index definitions for the tick4j stores.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code tick4j.ensure-indexes-on-startup=true};
 * in production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code tenant_cache})</h3>
 * <ul>
 *   <li><b>ttl_expireAt</b>: { expireAt: 1 } with {@code expireAfterSeconds: 0}
 *       <br/>Lets MongoDB delete cache values once their physical ttl has passed.</li>
 *   <li><b>idx_tenant_key</b>: { tenantId: 1, key: 1 }
 *       <br/>Used by bulk removal (eviction, clear).</li>
 * </ul>
 * The {@code tenant_state} collection is only accessed by {@code _id}.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.tenant_cache.createIndex({ expireAt: 1 }, { name: "ttl_expireAt", expireAfterSeconds: 0 });
 * db.tenant_cache.createIndex({ tenantId: 1, key: 1 }, { name: "idx_tenant_key" });
 * </pre>
 */
public class Tick4jMongoIndexConfig {

    public static final String TTL_EXPIRE_AT = "ttl_expireAt";
    public static final String IDX_TENANT_KEY = "idx_tenant_key";

    private final MongoTemplate mongoTemplate;

    public Tick4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the indexes listed above. Not called at startup unless enabled by property.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(CacheEntryDocument.class).ensureIndex(expireAtTtlIndex());
        mongoTemplate.indexOps(CacheEntryDocument.class).ensureIndex(tenantKeyIndex());
    }

    public static Index expireAtTtlIndex() {
        return new Index()
                .on("expireAt", Sort.Direction.ASC)
                .expire(Duration.ZERO)
                .named(TTL_EXPIRE_AT);
    }

    public static Index tenantKeyIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("key", Sort.Direction.ASC)
                .named(IDX_TENANT_KEY);
    }
}
