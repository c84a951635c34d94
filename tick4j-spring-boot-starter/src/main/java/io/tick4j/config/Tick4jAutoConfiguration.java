package io.tick4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tick4j.JobHandler;
import io.tick4j.cache.CacheProducer;
import io.tick4j.cache.CacheProducerRegistry;
import io.tick4j.core.JobHandlerRegistry;
import io.tick4j.internal.memory.InMemoryKeyValueStore;
import io.tick4j.internal.memory.InMemoryTenantStateStore;
import io.tick4j.internal.mongo.MongoKeyValueStore;
import io.tick4j.internal.mongo.MongoTenantStateStore;
import io.tick4j.resilience.Sleeper;
import io.tick4j.runtime.TenantRuntimes;
import io.tick4j.spi.KeyValueStore;
import io.tick4j.spi.TenantStateStore;
import io.tick4j.spi.TriggerManager;
import io.tick4j.utils.CadenceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for tick4j components.
 *
 * <p>State and cache values go to MongoDB when a {@link MongoTemplate} bean exists, otherwise to
 * process-local stores.
 */
@AutoConfiguration(after = MongoDataAutoConfiguration.class)
@EnableConfigurationProperties(Tick4jProperties.class)
@ConditionalOnProperty(prefix = "tick4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Tick4jAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(Tick4jAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock tick4jClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantStateStore tenantStateStore(ObjectProvider<MongoTemplate> mongoTemplate,
                                             ObjectProvider<ObjectMapper> objectMapper,
                                             Clock clock) {
        MongoTemplate template = mongoTemplate.getIfAvailable();
        if (template == null) {
            log.warn("no MongoTemplate available, tenant state is kept in memory");
            return new InMemoryTenantStateStore();
        }
        return new MongoTenantStateStore(template, objectMapper.getIfAvailable(ObjectMapper::new), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore(ObjectProvider<MongoTemplate> mongoTemplate, Clock clock) {
        MongoTemplate template = mongoTemplate.getIfAvailable();
        return template == null ? new InMemoryKeyValueStore(clock) : new MongoKeyValueStore(template, clock);
    }

    @Bean
    @ConditionalOnBean(MongoTemplate.class)
    @ConditionalOnMissingBean
    protected Tick4jMongoIndexConfig tick4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Tick4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(name = "tick4jTaskScheduler")
    public ThreadPoolTaskScheduler tick4jTaskScheduler(Tick4jProperties props) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("tick4j-");
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerManager triggerManager(ThreadPoolTaskScheduler tick4jTaskScheduler, Tick4jProperties props, Clock clock) {
        return new TaskSchedulerTriggerManager(tick4jTaskScheduler, props.getTickInterval(), props.getInitialTickDelay(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler>> handlersProvider, Tick4jProperties props) {
        List<JobHandler> handlers = new ArrayList<>();
        for (JobHandler handler : handlersProvider.getIfAvailable(List::of)) {
            String spec = props.getCadences().get(handler.name());
            if (spec == null) {
                handlers.add(handler);
            } else {
                log.info("job cadence overridden name={} cadence={}", handler.name(), spec);
                handlers.add(new CadenceOverrideJobHandler(handler,
                        CadenceParser.parse(spec, props.getZone(), props.getTickInterval())));
            }
        }
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheProducerRegistry cacheProducerRegistry(ObjectProvider<List<CacheProducer<?>>> producersProvider) {
        return new CacheProducerRegistry(producersProvider.getIfAvailable(List::of));
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantRuntimes tenantRuntimes(KeyValueStore keyValueStore,
                                         TenantStateStore stateStore,
                                         TriggerManager triggerManager,
                                         JobHandlerRegistry jobHandlerRegistry,
                                         CacheProducerRegistry cacheProducerRegistry,
                                         ObjectProvider<ObjectMapper> objectMapper,
                                         Tick4jProperties props,
                                         Clock clock) {
        return new TenantRuntimes(keyValueStore, stateStore, triggerManager, jobHandlerRegistry,
                cacheProducerRegistry, objectMapper.getIfAvailable(ObjectMapper::new), props.toRuntimeSettings(),
                clock, Sleeper.threadSleep());
    }

    @Bean
    @ConditionalOnMissingBean
    public Tick4jLifecycle tick4jLifecycle(TenantRuntimes tenantRuntimes) {
        return new Tick4jLifecycle(tenantRuntimes);
    }

    @Bean
    @ConditionalOnBean(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "tick4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton tick4jIndexesInitializer(Tick4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
