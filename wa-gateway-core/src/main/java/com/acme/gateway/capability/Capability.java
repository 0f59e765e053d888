package com.acme.gateway.capability;

/**
 * A named domain action. {@code dependency} names the circuit breaker guarding the downstream
 * system the handler talks to, or is null for purely in-process actions.
 */
public record Capability(
    String name,
    String description,
    String dependency,
    ParamSchema schema,
    CapabilityHandler handler) {}
