package com.example.collab.shared.config;

import com.example.collab.shared.service.StoreHealthTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics for the collaboration core. The registry itself is supplied by Spring Boot Actuator.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder storeHealthMetrics(StoreHealthTracker storeHealthTracker) {
        return registry -> {
            Gauge.builder("collab.store.degraded", storeHealthTracker, tracker -> tracker.isDegraded() ? 1 : 0)
                    .description("1 while the shared store is unreachable and delivery is local-only")
                    .register(registry);
            Gauge.builder("collab.store.failures", storeHealthTracker, StoreHealthTracker::getFailureCount)
                    .description("Store operations that failed since startup")
                    .register(registry);
        };
    }

    @Bean
    public CollabMetricsCollector collabMetricsCollector(MeterRegistry registry) {
        return new CollabMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths don't hit the registry lookup each time.
     */
    public static class CollabMetricsCollector {
        private final MeterRegistry registry;
        private final Map<String, Counter> counters = new ConcurrentHashMap<>();
        private final Map<String, Timer> timers = new ConcurrentHashMap<>();

        public CollabMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            counters.computeIfAbsent(meterKey(name, tags), k -> registry.counter(name, tags)).increment();
        }

        public void recordLatency(String name, Duration latency, String... tags) {
            timers.computeIfAbsent(meterKey(name, tags), k -> Timer.builder(name).tags(tags).register(registry))
                    .record(latency);
        }

        private static String meterKey(String name, String... tags) {
            return tags.length == 0 ? name : name + '|' + String.join(",", tags);
        }
    }
}
