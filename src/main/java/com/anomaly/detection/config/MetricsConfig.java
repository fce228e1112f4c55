package com.anomaly.detection.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger registeredDetectors;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.registeredDetectors = registry.gauge("detector.registered", new AtomicInteger(0));
    }

    public void recordDetection(String detector, String type, boolean anomaly, long elapsedNanos) {
        Counter.builder("detector.detection.count")
                .tag("detector", detector)
                .tag("type", type)
                .tag("result", anomaly ? "anomaly" : "normal")
                .register(registry)
                .increment();

        Timer.builder("detector.detection.latency")
                .tag("detector", detector)
                .tag("type", type)
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordTraining(String detector, String type) {
        Counter.builder("detector.training.count")
                .tag("detector", detector)
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordEvent(String detector, String event) {
        Counter.builder("detector.event.count")
                .tag("detector", detector)
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public void recordSnapshot(String status) {
        Counter.builder("detector.snapshot.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateRegisteredCount(int count) {
        registeredDetectors.set(count);
    }
}
