package com.example.identity.auth;

/** Actions a capability token can authorize on an entity. */
public enum Action {
  READ("read"),
  WRITE_ADMIN("writeAdmin"),
  WRITE_GROUPS("writeGroups"),
  READ_GROUPS("readGroups"),
  CREATE_AGENT("createAgent"),
  READ_SSH_KEYS("readSSHKeys"),
  WRITE_SSH_KEYS("writeSSHKeys"),
  READ_ADMIN("readAdmin"),
  VERIFY("verify"),
  DISCHARGE_FOR("dischargeFor"),
  LOGIN("login");

  private final String value;

  Action(String value) {
    this.value = value;
  }

  /** Name used in capability token caveats. */
  public String value() {
    return value;
  }
}
