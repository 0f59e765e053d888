package com.acme.gateway.web;

import com.acme.gateway.capability.CapabilityGateway;
import com.acme.gateway.processor.capabilities.ConversationCapabilities;
import com.acme.gateway.processor.conversation.ConversationState;
import com.acme.gateway.processor.conversation.ConversationStateService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Put;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Controller("/api/states")
@ExecuteOn(TaskExecutors.BLOCKING)
public class ConversationController {

  private final CapabilityGateway gateway;
  private final ConversationStateService states;

  public ConversationController(CapabilityGateway gateway, ConversationStateService states) {
    this.gateway = gateway;
    this.states = states;
  }

  @Get("/{sessionId}/{jid}")
  public HttpResponse<ApiResponse<Object>> get(
      @PathVariable String sessionId, @PathVariable String jid) {
    return Responses.ok(gateway.execute(ConversationCapabilities.GET_STATE, chat(sessionId, jid)));
  }

  @Put("/{sessionId}/{jid}")
  public HttpResponse<ApiResponse<Object>> update(
      @PathVariable String sessionId, @PathVariable String jid, @Body Map<String, Object> body) {
    Map<String, Object> args = new HashMap<>(body);
    args.putAll(chat(sessionId, jid));
    return Responses.ok(gateway.execute(ConversationCapabilities.UPDATE_STATE, args));
  }

  @Post("/{sessionId}/{jid}/history")
  public HttpResponse<ApiResponse<Object>> addToHistory(
      @PathVariable String sessionId, @PathVariable String jid, @Body Map<String, Object> body) {
    Map<String, Object> args = new HashMap<>(body);
    args.putAll(chat(sessionId, jid));
    return Responses.created(gateway.execute(ConversationCapabilities.ADD_TO_HISTORY, args));
  }

  @Delete("/{sessionId}/{jid}")
  public HttpResponse<ApiResponse<Object>> clear(
      @PathVariable String sessionId, @PathVariable String jid) {
    return Responses.ok(
        gateway.execute(ConversationCapabilities.CLEAR_STATE, chat(sessionId, jid)));
  }

  @Get("/{sessionId}")
  public HttpResponse<ApiResponse<List<ConversationState>>> list(@PathVariable String sessionId) {
    return Responses.ok(states.listBySession(sessionId));
  }

  private static Map<String, Object> chat(String sessionId, String jid) {
    return ContactController.args(sessionId, "jid", jid);
  }
}
