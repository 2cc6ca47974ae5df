package com.nayem.waypoint.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.waypoint.core.StateMachine;
import com.nayem.waypoint.events.DomainEventEmitter;
import com.nayem.waypoint.events.RedisStreamEventTransport;
import com.nayem.waypoint.idempotency.IdempotencyStore;
import com.nayem.waypoint.idempotency.InMemoryIdempotencyStore;
import com.nayem.waypoint.idempotency.RedisIdempotencyStore;
import com.nayem.waypoint.persistence.InMemoryStateObjectRepository;
import com.nayem.waypoint.persistence.JacksonStateObjectSerializer;
import com.nayem.waypoint.persistence.RedisStateObjectRepository;
import com.nayem.waypoint.persistence.StateObjectRepository;
import com.nayem.waypoint.persistence.StateObjectSerializer;
import com.nayem.waypoint.telemetry.AlertPublisher;
import com.nayem.waypoint.telemetry.LoggingAlertPublisher;
import com.nayem.waypoint.telemetry.TransitionMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(WaypointProperties.class)
public class WaypointAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WaypointAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TransitionMetrics transitionMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new TransitionMetrics(registryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertPublisher alertPublisher() {
        return new LoggingAlertPublisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyStore idempotencyStore(WaypointProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        WaypointProperties.Idempotency config = properties.getIdempotency();
        String store = config.getStore();
        return switch (store.toLowerCase()) {
            case "memory" -> new InMemoryIdempotencyStore(Clock.systemUTC(), config.getTtl());
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("Redis is required for the Redis idempotency store");
                }
                yield new RedisIdempotencyStore(redis, config.getKeyPrefix(), config.getTtl());
            }
            default -> {
                log.warn("Unknown idempotency store '{}', falling back to memory", store);
                yield new InMemoryIdempotencyStore(Clock.systemUTC(), config.getTtl());
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public StateMachine stateMachine(WaypointProperties properties,
            IdempotencyStore idempotencyStore,
            TransitionMetrics transitionMetrics,
            AlertPublisher alertPublisher,
            ObjectProvider<TransitionConfigurer> configurers) {

        StateMachine machine = StateMachine.builder()
                .handlerConfig(properties.getHandlers().toHandlerConfig())
                .idempotencyStore(idempotencyStore)
                .metrics(transitionMetrics)
                .alertPublisher(alertPublisher)
                .logTransitions(properties.getLogging().isTransitions())
                .debugLogging(properties.getLogging().isDebug())
                .build();

        configurers.orderedStream().forEach(configurer -> configurer.configure(machine));
        log.info("Waypoint state machine ready with {} transitions", machine.getRegistry().size());
        return machine;
    }

    @Bean
    @ConditionalOnMissingBean
    public StateObjectSerializer stateObjectSerializer(ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return new JacksonStateObjectSerializer(mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public StateObjectRepository stateObjectRepository(WaypointProperties properties,
            StateObjectSerializer serializer,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        String store = properties.getPersistence().getStore();
        return switch (store.toLowerCase()) {
            case "memory" -> new InMemoryStateObjectRepository(serializer);
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("Redis is required for the Redis state object store");
                }
                yield new RedisStateObjectRepository(redis, serializer, properties.getPersistence().getKeyPrefix());
            }
            default -> {
                log.warn("Unknown state object store '{}', falling back to memory", store);
                yield new InMemoryStateObjectRepository(serializer);
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventEmitter domainEventEmitter(WaypointProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        DomainEventEmitter emitter = new DomainEventEmitter(mapper);

        String transport = properties.getEvents().getTransport();
        switch (transport.toLowerCase()) {
            case "none" -> log.debug("No domain event transport configured");
            case "redis-stream" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("Redis is required for the Redis stream event transport");
                }
                emitter.configure(new RedisStreamEventTransport(redis, properties.getEvents().getStreamKey()));
            }
            default -> log.warn("Unknown event transport '{}', events will not be emitted", transport);
        }
        return emitter;
    }
}
