package com.acme.gateway.queue;

public record QueueStats(String queue, int pending, int processing, int completed, int dead) {}
