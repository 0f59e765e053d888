package com.acme.gateway.web;

import com.acme.gateway.capability.CapabilityGateway;
import com.acme.gateway.processor.capabilities.PresenceCapabilities;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.Map;

@Controller("/api/presence")
@ExecuteOn(TaskExecutors.BLOCKING)
public class PresenceController {

  private final CapabilityGateway gateway;

  public PresenceController(CapabilityGateway gateway) {
    this.gateway = gateway;
  }

  @Post("/update")
  public HttpResponse<ApiResponse<Object>> update(@Body Map<String, Object> body) {
    return Responses.ok(gateway.execute(PresenceCapabilities.UPDATE_PRESENCE, body));
  }

  @Post("/{jid}/typing")
  public HttpResponse<ApiResponse<Object>> typing(
      @PathVariable String jid,
      @QueryValue(defaultValue = "") String sessionId,
      @Nullable @QueryValue Long duration) {
    Map<String, Object> args = ContactController.args(sessionId, "jid", jid);
    if (duration != null) {
      args.put("duration", duration);
    }
    return Responses.ok(gateway.execute(PresenceCapabilities.SET_TYPING, args));
  }
}
