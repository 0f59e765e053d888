package com.acme.gateway.spi;

import java.util.List;

public record GroupMetadata(
    String id, String subject, String description, String owner, List<Participant> participants) {

  public record Participant(String jid, boolean admin) {}
}
