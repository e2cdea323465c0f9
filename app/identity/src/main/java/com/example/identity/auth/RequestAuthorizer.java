package com.example.identity.auth;

import com.example.identity.api.request.ApiRequest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RequestAuthorizer {

  private static final Logger logger = LoggerFactory.getLogger(RequestAuthorizer.class);

  private final OperationResolver operationResolver;
  private final CapabilityChecker capabilityChecker;

  /**
   * Resolves the operation {@code request} needs and checks it.
   *
   * @return the operation that was allowed
   * @throws PermissionDeniedException when the caller may not perform it
   */
  public Operation authorize(ApiRequest request, Credentials credentials) {
    final Operation operation = operationResolver.resolve(request);
    if (operation.isNone()) {
      throw new PermissionDeniedException(operation);
    }
    if (operation.equals(Operation.LOGIN)) {
      if (credentials.authenticatedUser().isEmpty()) {
        throw new PermissionDeniedException(operation);
      }
      return operation;
    }
    if (!capabilityChecker.allow(operation, credentials)) {
      logger.debug(
          "capability check denied entity={} action={}",
          operation.entity(),
          operation.action().value());
      throw new PermissionDeniedException(operation);
    }
    return operation;
  }
}
