package com.shlokmestry.guard.observability;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

@Component
public class CredentialMetrics {

    private final MeterRegistry registry;

    public CredentialMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void decryptFailure(String field) {
        Counter.builder("credentials.decrypt_failures.total")
                .description("Stored tokens that could not be decrypted on read")
                .tag("field", field)
                .register(registry)
                .increment();
    }
}
