package com.acme.gateway.web;

import com.acme.gateway.capability.CapabilityGateway;
import com.acme.gateway.processor.capabilities.DirectoryCapabilities;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.HashMap;
import java.util.Map;

@Controller("/api")
@ExecuteOn(TaskExecutors.BLOCKING)
public class ContactController {

  private final CapabilityGateway gateway;

  public ContactController(CapabilityGateway gateway) {
    this.gateway = gateway;
  }

  @Get("/contacts/{jid}")
  public HttpResponse<ApiResponse<Object>> profile(
      @PathVariable String jid, @QueryValue(defaultValue = "") String sessionId) {
    return Responses.ok(
        gateway.execute(DirectoryCapabilities.CONTACT_PROFILE, args(sessionId, "jid", jid)));
  }

  @Get("/groups/{groupId}")
  public HttpResponse<ApiResponse<Object>> group(
      @PathVariable String groupId, @QueryValue(defaultValue = "") String sessionId) {
    return Responses.ok(
        gateway.execute(DirectoryCapabilities.GROUP_METADATA, args(sessionId, "groupId", groupId)));
  }

  static Map<String, Object> args(String sessionId, String key, String value) {
    Map<String, Object> args = new HashMap<>();
    args.put("sessionId", sessionId);
    args.put(key, value);
    return args;
  }
}
