package com.example.collab.session.metrics;

import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.throttle.ThrottlingPipeline;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SessionMetricsBinder implements MeterBinder {

    private final SessionCoordinator sessionCoordinator;
    private final ThrottlingPipeline throttlingPipeline;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("collab.connections.active", sessionCoordinator, SessionCoordinator::getConnectionCount)
                .description("Connections owned by this instance")
                .register(registry);
        Gauge.builder("collab.rooms.active", sessionCoordinator, SessionCoordinator::getRoomCount)
                .description("Rooms with local members or inside their grace period")
                .register(registry);
        Gauge.builder("collab.throttle.streams", throttlingPipeline, ThrottlingPipeline::activeStreamCount)
                .description("Open coalescing streams")
                .register(registry);
    }
}
