package com.acme.gateway.processor.directory;

import com.acme.gateway.error.GatewayException;
import com.acme.gateway.events.EventNames;
import com.acme.gateway.processor.session.SessionAccess;
import com.acme.gateway.spi.ContactProfile;
import com.acme.gateway.spi.EventSink;
import com.acme.gateway.spi.GroupMetadata;
import jakarta.inject.Singleton;
import java.util.Map;
import lombok.RequiredArgsConstructor;

/** Contact and group lookups through a connected session. */
@Singleton
@RequiredArgsConstructor
public class DirectoryService {

  private final SessionAccess sessions;
  private final EventSink events;

  public ContactProfile getProfile(String sessionId, String jid) {
    ContactProfile profile =
        sessions
            .requireConnected(sessionId)
            .fetchProfile(sessionId, jid)
            .orElseThrow(() -> GatewayException.notFound("Contact"));
    events.emit(EventNames.CONTACT_PROFILE_FETCHED, Map.of("sessionId", sessionId, "jid", jid));
    return profile;
  }

  public GroupMetadata getGroup(String sessionId, String groupJid) {
    GroupMetadata group =
        sessions
            .requireConnected(sessionId)
            .fetchGroupMetadata(sessionId, groupJid)
            .orElseThrow(() -> GatewayException.notFound("Group"));
    events.emit(
        EventNames.GROUP_METADATA_FETCHED, Map.of("sessionId", sessionId, "groupId", groupJid));
    return group;
  }
}
