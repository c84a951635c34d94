package io.tick4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tick4j.spi.StateSection;
import io.tick4j.spi.TenantStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * MongoDB persistence of per-tenant state, one document per tenant with one sub-document per section.
 *
 * <p>Section values are converted to plain maps with Jackson (instants as ISO strings) and written
 * with a targeted {@code $set}, so concurrent writers of different sections do not clobber each other.
 * Writers of the same section race: the last write wins.
 */
public class MongoTenantStateStore implements TenantStateStore {
    private static final Logger log = LoggerFactory.getLogger(MongoTenantStateStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoTenantStateStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public <T> T read(String tenantId, StateSection<T> section) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(section, "section must not be null");

        Query query = byTenant(tenantId);
        query.fields().include(path(section));
        TenantStateDocument doc = mongoTemplate.findOne(query, TenantStateDocument.class);

        Object raw = doc == null || doc.getSections() == null ? null : doc.getSections().get(section.name());
        if (raw == null) {
            return section.initial().get();
        }
        try {
            return objectMapper.convertValue(raw, section.type());
        } catch (IllegalArgumentException e) {
            log.warn("tenant state section unreadable, using initial value tenant={} section={} msg={}",
                    tenantId, section.name(), e.getMessage());
            return section.initial().get();
        }
    }

    @Override
    public <T> T update(String tenantId, StateSection<T> section, UnaryOperator<T> mutator) {
        Objects.requireNonNull(mutator, "mutator must not be null");

        T next = Objects.requireNonNull(mutator.apply(read(tenantId, section)), "mutator must not return null");
        Map<String, Object> raw = objectMapper.convertValue(next, MAP_TYPE);

        Update update = new Update()
                .set(path(section), raw)
                .set("updatedAt", clock.instant());
        mongoTemplate.upsert(byTenant(tenantId), update, TenantStateDocument.class);
        return next;
    }

    @Override
    public Set<String> tenantIds() {
        Query query = new Query();
        query.fields().include("_id");
        Set<String> ids = new LinkedHashSet<>();
        for (TenantStateDocument doc : mongoTemplate.find(query, TenantStateDocument.class)) {
            ids.add(doc.getId());
        }
        return ids;
    }

    private static Query byTenant(String tenantId) {
        return new Query(Criteria.where("_id").is(tenantId));
    }

    private static String path(StateSection<?> section) {
        return "sections." + section.name();
    }
}
