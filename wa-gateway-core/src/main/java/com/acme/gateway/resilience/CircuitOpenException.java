package com.acme.gateway.resilience;

import com.acme.gateway.error.ErrorCode;
import com.acme.gateway.error.GatewayException;

/** Raised instead of calling a dependency whose breaker is open. */
public class CircuitOpenException extends GatewayException {
  private final String breakerName;

  public CircuitOpenException(String breakerName) {
    super(ErrorCode.CIRCUIT_OPEN, "Service temporarily unavailable");
    this.breakerName = breakerName;
  }

  public String getBreakerName() {
    return breakerName;
  }
}
