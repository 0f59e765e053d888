package com.acme.gateway.capability;

import com.acme.gateway.error.GatewayError;

/** Normalized outcome of a gateway invocation: either data or a taxonomy error, never both. */
public record ToolResult(boolean success, Object data, GatewayError error) {

  public static ToolResult ok(Object data) {
    return new ToolResult(true, data, null);
  }

  public static ToolResult failed(GatewayError error) {
    return new ToolResult(false, null, error);
  }

  public boolean isError() {
    return !success;
  }
}
