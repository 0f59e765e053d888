package com.acme.gateway.spi;

public record ContactProfile(
    String jid, String name, String status, String pictureUrl, boolean business) {}
