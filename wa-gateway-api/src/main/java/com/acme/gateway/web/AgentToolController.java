package com.acme.gateway.web;

import com.acme.gateway.capability.Capability;
import com.acme.gateway.capability.CapabilityGateway;
import com.acme.gateway.capability.ParamSchema;
import com.acme.gateway.capability.ToolResult;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.List;
import java.util.Map;

/**
 * Agent-facing tool calls. Everything goes through {@link CapabilityGateway#invoke}, so the
 * allowlist, the agent rate-limit tier and error sanitizing always apply. Unknown and forbidden
 * tool names get the same 403 body.
 */
@Controller("/agent/tools")
@ExecuteOn(TaskExecutors.BLOCKING)
public class AgentToolController {

  private final CapabilityGateway gateway;
  private final IdentityResolver identities;

  public AgentToolController(CapabilityGateway gateway, IdentityResolver identities) {
    this.gateway = gateway;
    this.identities = identities;
  }

  public record ToolParam(String name, String kind, boolean required, String description) {}

  public record ToolDescriptor(String name, String description, List<ToolParam> parameters) {

    static ToolDescriptor of(Capability capability) {
      return new ToolDescriptor(
          capability.name(),
          capability.description(),
          capability.schema().fields().stream().map(ToolDescriptor::param).toList());
    }

    private static ToolParam param(ParamSchema.Field f) {
      return new ToolParam(f.name(), f.kind().name().toLowerCase(), f.required(), f.description());
    }
  }

  @Get
  public HttpResponse<ApiResponse<List<ToolDescriptor>>> tools() {
    return Responses.ok(gateway.listTools().stream().map(ToolDescriptor::of).toList());
  }

  @Post("/{name}")
  public HttpResponse<?> call(
      HttpRequest<?> request, @PathVariable String name, @Nullable @Body Map<String, Object> args) {
    ToolResult result = gateway.invoke(name, args, identities.resolve(request));
    if (result.isError()) {
      return Responses.error(result.error());
    }
    return Responses.ok(result.data());
  }
}
