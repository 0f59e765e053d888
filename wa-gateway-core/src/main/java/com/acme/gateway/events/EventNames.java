package com.acme.gateway.events;

import java.util.List;

/** Event names shared by the capabilities, the queues and the webhook fan-out. */
public final class EventNames {

  // Domain events
  public static final String MESSAGE_SENT = "message.sent";
  public static final String MESSAGE_RECEIVED = "message.received";
  public static final String MESSAGE_STATUS = "message.status";
  public static final String PRESENCE_UPDATED = "presence.updated";
  public static final String CONTACT_PROFILE_FETCHED = "contact.profile.fetched";
  public static final String GROUP_METADATA_FETCHED = "group.metadata.fetched";
  public static final String CONVERSATION_READ = "conversation.read";
  public static final String CONVERSATION_UPDATED = "conversation.updated";
  public static final String CONVERSATION_CLEARED = "conversation.cleared";
  public static final String CONNECTION_OPEN = "connection.open";
  public static final String CONNECTION_CLOSE = "connection.close";
  public static final String QR_UPDATE = "qr.update";

  // Queue lifecycle
  public static final String JOB_COMPLETED = "queue.job.completed";
  public static final String JOB_DEAD = "queue.job.dead";

  /** Events forwarded to registered webhooks. */
  public static final List<String> WEBHOOK_EVENTS =
      List.of(
          MESSAGE_RECEIVED,
          MESSAGE_SENT,
          MESSAGE_STATUS,
          CONNECTION_OPEN,
          CONNECTION_CLOSE,
          QR_UPDATE);

  private EventNames() {}
}
