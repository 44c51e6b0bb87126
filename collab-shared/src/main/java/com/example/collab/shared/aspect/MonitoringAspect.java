package com.example.collab.shared.aspect;

import com.example.collab.shared.config.MonitoringConfig;
import com.example.collab.shared.exception.CollabException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.time.Duration;

/**
 * Times every call on a {@link Monitored} bean as {@code collab.<operation>.latency}, tagged with the outcome.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.CollabMetricsCollector metricsCollector;

    @Around("@within(com.example.collab.shared.aspect.Monitored) || @annotation(com.example.collab.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        // Method-level annotation wins over the class-level one.
        Monitored monitored = method.getAnnotation(Monitored.class);
        if (monitored == null) {
            monitored = joinPoint.getTarget().getClass().getAnnotation(Monitored.class);
        }
        if (monitored == null) {
            return joinPoint.proceed();
        }

        String operation = monitored.value();
        String component = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long started = System.nanoTime();
        try {
            Object result = joinPoint.proceed();
            record(operation, component, methodName, started, "success");
            return result;
        } catch (CollabException e) {
            // rejected requests (busy lock, full room) are outcomes, not faults
            record(operation, component, methodName, started, e.getErrorCode().getCode());
            throw e;
        } catch (Exception e) {
            Duration elapsed = record(operation, component, methodName, started, "error");
            metricsCollector.incrementCounter("collab.errors", "operation", operation, "component", component);
            log.debug("{}.{} failed after {}ms: {}", component, methodName, elapsed.toMillis(), e.getMessage());
            throw e;
        }
    }

    private Duration record(String operation, String component, String methodName, long started, String outcome) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metricsCollector.recordLatency("collab." + operation + ".latency", elapsed,
                "component", component, "method", methodName, "outcome", outcome);
        return elapsed;
    }
}
