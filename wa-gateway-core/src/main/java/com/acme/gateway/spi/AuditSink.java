package com.acme.gateway.spi;

import java.util.Map;

/** Append-only trail of administrative actions. */
public interface AuditSink {

  void record(String action, String actor, String result, Map<String, Object> details);

  default void success(String action, String actor, Map<String, Object> details) {
    record(action, actor, "success", details);
  }

  default void failure(String action, String actor, Map<String, Object> details) {
    record(action, actor, "failure", details);
  }
}
