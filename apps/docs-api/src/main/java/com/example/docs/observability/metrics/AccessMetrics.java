package com.example.docs.observability.metrics;

import com.example.docs.access.model.AccessDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Counters for access decisions. Tag values come from closed enums only.
 */
@Component
public class AccessMetrics {

    private static final String TAG_NONE = "none";

    private final MeterRegistry registry;
    private final Counter adminPrivateView;

    public AccessMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
        this.adminPrivateView = Counter.builder("access.admin_private_view")
                .description("Admin reads of private resources they do not own")
                .register(registry);
    }

    public void recordDecision(@NonNull AccessDecision decision) {
        Counter.builder("access.decision")
                .tag("result", decision.isAllowed() ? "allowed" : "denied")
                .tag("reason", decision.reason() != null ? decision.reason().name().toLowerCase() : TAG_NONE)
                .description("Access decisions by result and deny reason")
                .register(registry)
                .increment();

        if (decision.adminPrivateView()) {
            adminPrivateView.increment();
        }
    }
}
