package io.tick4j.cache;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Startup-time mapping from producer name to {@link CacheProducer}.
 */
public class CacheProducerRegistry {

    private final Map<String, CacheProducer<?>> producersByName;

    public CacheProducerRegistry(List<? extends CacheProducer<?>> producers) {
        this.producersByName = producers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        CacheProducer::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate CacheProducer name: " + a.name());
                        }
                ));
    }

    public static CacheProducerRegistry empty() {
        return new CacheProducerRegistry(List.of());
    }

    public boolean contains(String name) {
        return name != null && producersByName.containsKey(name);
    }

    public Optional<CacheProducer<?>> find(String name) {
        return Optional.ofNullable(name == null ? null : producersByName.get(name));
    }

    public CacheProducer<?> getRequired(String name) {
        CacheProducer<?> producer = name == null ? null : producersByName.get(name);
        if (producer == null) {
            throw new IllegalStateException("No CacheProducer registered for name: " + name);
        }
        return producer;
    }

    @SuppressWarnings("unchecked")
    public <T> CacheProducer<T> getRequired(String name, Class<T> type) {
        CacheProducer<?> producer = getRequired(name);
        if (!type.isAssignableFrom(producer.type())) {
            throw new IllegalArgumentException("CacheProducer " + name + " produces " + producer.type().getName()
                    + ", not " + type.getName());
        }
        return (CacheProducer<T>) producer;
    }
}
