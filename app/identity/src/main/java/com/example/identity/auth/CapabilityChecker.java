package com.example.identity.auth;

/**
 * Checks presented capability tokens against an operation.
 *
 * <p>Token minting, discharge and caveat verification live behind this interface.
 */
public interface CapabilityChecker {

  boolean allow(Operation operation, Credentials credentials);
}
