package io.tick4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for tenant cache values. Documents are removed by a TTL index on
 * {@code expireAt}; reads filter on it too, since the TTL monitor runs only once a minute.
 */
@Document(collection = "tenant_cache")
public class CacheEntryDocument {

    @Id
    private String id;

    private String tenantId;
    private String key;
    private String value;
    private Instant expireAt;

    public CacheEntryDocument() {
    }

    static String idOf(String tenantId, String key) {
        return tenantId + ":" + key;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public Instant getExpireAt() {
        return expireAt;
    }

    public void setExpireAt(Instant expireAt) {
        this.expireAt = expireAt;
    }
}
