package com.acme.gateway.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Agent capability allowlist and denylist. Populated independently; the defaults mirror the
 * actions an agent needs for conversational messaging and the administrative actions it must
 * never reach.
 */
public class GatewayPolicyConfig {

  private List<String> allowlist =
      new ArrayList<>(
          List.of(
              "send_text_message",
              "reply_message",
              "get_contact_profile",
              "get_group_metadata",
              "set_typing",
              "get_conversation_state",
              "update_conversation_state",
              "add_to_history",
              "clear_conversation_state"));

  private List<String> denylist =
      new ArrayList<>(
          List.of(
              "delete_session",
              "create_session",
              "raw_socket_access",
              "modify_credentials",
              "export_auth_state",
              "import_auth_state",
              "execute_raw_command",
              "list_all_sessions",
              "revoke_api_key"));

  public List<String> getAllowlist() {
    return allowlist;
  }

  public void setAllowlist(List<String> allowlist) {
    this.allowlist = allowlist;
  }

  public List<String> getDenylist() {
    return denylist;
  }

  public void setDenylist(List<String> denylist) {
    this.denylist = denylist;
  }

  @Override
  public String toString() {
    return "GatewayPolicyConfig{allowlist=" + allowlist + ", denylist=" + denylist + "}";
  }
}
