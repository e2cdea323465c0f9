package com.example.identity.service;

import com.example.identity.model.LocalUser;

/** Looks up the local user behind an external identity asserted by an identity provider. */
public interface UserResolver {

  /**
   * @throws UserNotFoundException when no local user is linked to {@code externalId}
   * @throws AccountIntegrationException when the user store cannot be queried
   */
  LocalUser findUserByExternalId(String externalId);
}
