package com.polymind.ingestion.adapter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Round-robin RPC endpoint selection. Endpoints that rate-limited or failed are skipped until their cooldown ends.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public RpcEndpointRotator(List<String> endpoints) {
        this(endpoints, System::currentTimeMillis);
    }

    RpcEndpointRotator(List<String> endpoints, LongSupplier clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.clock = clock;
    }

    /**
     * Next endpoint not in cooldown, in round-robin order. If all are cooling down, plain round-robin.
     */
    public String getNextEndpoint() {
        long now = clock.getAsLong();
        for (int checked = 0; checked < endpoints.size(); checked++) {
            String endpoint = roundRobin();
            Long until = cooldownUntilMs.get(endpoint);
            if (until == null || until <= now) {
                return endpoint;
            }
        }
        return roundRobin();
    }

    public void markCoolingDown(String endpoint, long cooldownMs) {
        cooldownUntilMs.put(endpoint, clock.getAsLong() + Math.max(0L, cooldownMs));
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    private String roundRobin() {
        int i = index.getAndIncrement() % endpoints.size();
        if (i < 0) {
            i += endpoints.size();
        }
        return endpoints.get(i);
    }
}
