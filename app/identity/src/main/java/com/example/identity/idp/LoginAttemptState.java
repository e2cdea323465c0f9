package com.example.identity.idp;

/** Lifecycle of a single login attempt. SUCCEEDED and FAILED are terminal. */
public enum LoginAttemptState {
  STARTED,
  AWAITING_CALLBACK,
  VERIFYING,
  SUCCEEDED,
  FAILED
}
