package com.example.identity.service;

import com.example.identity.idp.LoginContext;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.model.LocalUser;

/** Receives the terminal outcome of a login attempt. Exactly one method is called per attempt. */
public interface LoginCompletion {

  void onLoginSuccess(String idp, LoginContext context, LocalUser user);

  void onLoginFailure(String idp, LoginContext context, LoginFailureException cause);
}
