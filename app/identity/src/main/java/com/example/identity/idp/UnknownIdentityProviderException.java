package com.example.identity.idp;

public class UnknownIdentityProviderException extends RuntimeException {

  public UnknownIdentityProviderException(String name) {
    super("identity provider \"" + name + "\" not found");
  }
}
