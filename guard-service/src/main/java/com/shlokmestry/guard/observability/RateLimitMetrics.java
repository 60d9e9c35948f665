package com.shlokmestry.guard.observability;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

@Component
public class RateLimitMetrics {

    private final MeterRegistry registry;

    public RateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void decision(String tier, boolean limited) {
        Counter.builder("ratelimit.decisions.total")
                .description("Total rate-limit decisions (limited/allowed)")
                .tag("limited", String.valueOf(limited))
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void storageFailure(String operation, boolean failedClosed) {
        Counter.builder("ratelimit.storage_failures.total")
                .description("Counter store failures, by the policy applied")
                .tag("operation", operation)
                .tag("outcome", failedClosed ? "fail_closed" : "fail_open")
                .register(registry)
                .increment();
    }
}
