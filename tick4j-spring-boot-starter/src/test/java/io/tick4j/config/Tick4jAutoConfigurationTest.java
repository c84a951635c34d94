package io.tick4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tick4j.Cadence;
import io.tick4j.JobHandler;
import io.tick4j.cache.CacheProducerRegistry;
import io.tick4j.core.Cadences;
import io.tick4j.core.JobHandlerRegistry;
import io.tick4j.internal.memory.InMemoryTenantStateStore;
import io.tick4j.internal.mongo.MongoKeyValueStore;
import io.tick4j.internal.mongo.MongoTenantStateStore;
import io.tick4j.runtime.TenantRuntime;
import io.tick4j.runtime.TenantRuntimes;
import io.tick4j.spi.KeyValueStore;
import io.tick4j.spi.TenantStateStore;
import io.tick4j.spi.TriggerManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class Tick4jAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(Tick4jAutoConfiguration.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(JobHandler.class, DigestJobHandler::new)
            .withPropertyValues(
                    "tick4j.tick-interval=30m",
                    "tick4j.retry.max-retries=2",
                    "tick4j.breaker.failure-threshold=3",
                    "tick4j.cache.max-items=50"
            );

    @Test
    void shouldAutoConfigureMongoBackedBeans() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(TenantRuntimes.class);
                    assertThat(context).hasSingleBean(Tick4jLifecycle.class);
                    assertThat(context).hasSingleBean(Tick4jProperties.class);
                    assertThat(context).hasSingleBean(Tick4jMongoIndexConfig.class);
                    assertThat(context.getBean(TenantStateStore.class)).isInstanceOf(MongoTenantStateStore.class);
                    assertThat(context.getBean(KeyValueStore.class)).isInstanceOf(MongoKeyValueStore.class);
                    assertThat(context.getBean(TriggerManager.class)).isInstanceOf(TaskSchedulerTriggerManager.class);
                });
    }

    @Test
    void shouldFallBackToInMemoryStoresWithoutMongo() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TenantRuntimes.class);
            assertThat(context).doesNotHaveBean(Tick4jMongoIndexConfig.class);
            assertThat(context.getBean(TenantStateStore.class)).isInstanceOf(InMemoryTenantStateStore.class);
        });
    }

    @Test
    void shouldBindPropertiesIntoTenantRuntime() {
        contextRunner.run(context -> {
            Tick4jProperties props = context.getBean(Tick4jProperties.class);
            assertThat(props.getTickInterval()).isEqualTo(Duration.ofMinutes(30));

            TenantRuntime runtime = context.getBean(TenantRuntimes.class).forTenant("tenant-a");
            assertThat(runtime.resilientCall().defaults().maxRetries()).isEqualTo(2);
            assertThat(runtime.breaker().settings().failureThreshold()).isEqualTo(3);
            assertThat(runtime.cache().settings().maxItems()).isEqualTo(50);
            assertThat(runtime.scheduler().jobNames()).containsExactly("digest");
            assertThat(context.getBean(CacheProducerRegistry.class).contains("anything")).isFalse();
        });
    }

    @Test
    void cadenceShouldBeOverriddenByProperty() {
        contextRunner
                .withPropertyValues("tick4j.zone=Europe/Berlin", "tick4j.cadences.digest=AT 07:00")
                .run(context -> {
                    Cadence cadence = context.getBean(JobHandlerRegistry.class).getRequired("digest").cadence();
                    assertThat(cadence).isEqualTo(Cadences.dailyAt(7, ZoneId.of("Europe/Berlin")));
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("tick4j.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(TenantRuntimes.class));
    }

    static class DigestJobHandler implements JobHandler {
        @Override
        public String name() {
            return "digest";
        }

        @Override
        public Cadence cadence() {
            return Cadences.dailyAt(8, ZoneId.of("UTC"));
        }

        @Override
        public void execute(TenantRuntime tenant) {
            // no-op for context bootstrap test
        }
    }
}
