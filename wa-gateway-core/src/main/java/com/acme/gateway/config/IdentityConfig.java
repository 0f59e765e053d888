package com.acme.gateway.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Peers allowed to assert a caller identity through request headers. Requests from any other
 * address are identified by that address alone. Pure POJO - no framework dependencies.
 */
public class IdentityConfig {

  private List<String> trustedProxies = new ArrayList<>(List.of("127.0.0.1", "0:0:0:0:0:0:0:1"));

  public List<String> getTrustedProxies() {
    return trustedProxies;
  }

  public void setTrustedProxies(List<String> trustedProxies) {
    this.trustedProxies = trustedProxies == null ? new ArrayList<>() : trustedProxies;
  }

  public boolean isTrusted(String peerAddress) {
    return peerAddress != null && trustedProxies.contains(peerAddress);
  }

  @Override
  public String toString() {
    return "IdentityConfig{trustedProxies=" + trustedProxies + "}";
  }
}
