package com.acme.gateway.processor.capabilities;

import com.acme.gateway.capability.Capability;
import com.acme.gateway.capability.CapabilityRegistry;
import com.acme.gateway.capability.ParamSchema;
import com.acme.gateway.processor.directory.DirectoryService;
import com.acme.gateway.resilience.CircuitBreakerRegistry;
import com.acme.gateway.spi.GroupMetadata;
import jakarta.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;

@Singleton
public class DirectoryCapabilities implements CapabilityProvider {

  public static final String CONTACT_PROFILE = "get_contact_profile";
  public static final String GROUP_METADATA = "get_group_metadata";

  private final DirectoryService directory;

  public DirectoryCapabilities(DirectoryService directory) {
    this.directory = directory;
  }

  @Override
  public void register(CapabilityRegistry registry) {
    registry.register(
        new Capability(
            CONTACT_PROFILE,
            "Get profile information for a WhatsApp contact",
            CircuitBreakerRegistry.WHATSAPP,
            ParamSchema.builder().sessionId().jid("jid", "Contact JID (phone@s.whatsapp.net)").build(),
            args -> directory.getProfile((String) args.get("sessionId"), (String) args.get("jid"))));
    registry.register(
        new Capability(
            GROUP_METADATA,
            "Get metadata for a WhatsApp group",
            CircuitBreakerRegistry.WHATSAPP,
            ParamSchema.builder().sessionId().jid("groupId", "Group JID (id@g.us)").build(),
            this::groupSummary));
  }

  // Participant JIDs stay out of the agent-visible result; only the count is exposed.
  private Object groupSummary(Map<String, Object> args) {
    GroupMetadata group =
        directory.getGroup((String) args.get("sessionId"), (String) args.get("groupId"));
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("id", group.id());
    result.put("subject", group.subject());
    result.put("description", group.description());
    result.put("owner", group.owner());
    result.put("participantCount", group.participants() == null ? 0 : group.participants().size());
    return result;
  }
}
