package com.acme.gateway.error;

import com.acme.gateway.core.TransientException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps any throwable onto the closed error taxonomy. Only {@link GatewayException} messages are
 * passed through; every other failure gets a fixed message and is logged here with its stack
 * trace.
 */
public final class ErrorMapper {
  private static final Logger LOG = LoggerFactory.getLogger(ErrorMapper.class);

  static final String DENIED_MESSAGE = "Capability not available";
  static final String INVALID_ARGUMENT_MESSAGE = "Invalid request parameters";
  static final String TRANSIENT_MESSAGE = "Temporary failure, please retry";
  static final String INTERNAL_MESSAGE = "Internal error";

  private ErrorMapper() {}

  public static GatewayError map(Throwable t) {
    if (t instanceof GatewayException ge) {
      return ge.toError();
    }
    if (t instanceof TransientException || t instanceof TimeoutException) {
      LOG.warn("Transient failure mapped to {}: {}", ErrorCode.TRANSIENT, t.getMessage());
      return GatewayError.of(ErrorCode.TRANSIENT, TRANSIENT_MESSAGE);
    }
    if (t instanceof IllegalArgumentException) {
      LOG.warn("Invalid argument mapped to {}: {}", ErrorCode.VALIDATION_ERROR, t.getMessage());
      return GatewayError.of(ErrorCode.VALIDATION_ERROR, INVALID_ARGUMENT_MESSAGE);
    }
    LOG.error("Unexpected failure mapped to {}", ErrorCode.INTERNAL, t);
    return GatewayError.of(ErrorCode.INTERNAL, INTERNAL_MESSAGE);
  }
}
