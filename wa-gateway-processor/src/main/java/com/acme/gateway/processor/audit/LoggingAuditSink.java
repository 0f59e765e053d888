package com.acme.gateway.processor.audit;

import com.acme.gateway.core.Jsons;
import com.acme.gateway.spi.AuditSink;
import jakarta.inject.Singleton;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Audit trail written to the dedicated {@code AUDIT} logger, one JSON object per record. */
@Singleton
public class LoggingAuditSink implements AuditSink {
  private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

  @Override
  public void record(String action, String actor, String result, Map<String, Object> details) {
    AUDIT.info(
        "action={} actor={} result={} details={}",
        action,
        actor,
        result,
        Jsons.toJson(details == null ? Map.of() : details));
  }
}
