package com.example.identity.service;

import com.example.identity.config.AccountClientProperties;
import com.example.identity.model.LocalUser;
import com.example.identity.service.dto.AccountUserResponse;
import com.example.identity.service.dto.ExternalIdLookupRequest;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** {@link UserResolver} backed by the account service's external id lookup. */
@Service
@RequiredArgsConstructor
public class AccountUserResolver implements UserResolver {

  private static final Logger logger = LoggerFactory.getLogger(AccountUserResolver.class);

  private final RestClient accountRestClient;
  private final AccountClientProperties properties;

  @Override
  public LocalUser findUserByExternalId(String externalId) {
    if (isBlank(externalId)) {
      throw new IllegalArgumentException("externalId is required");
    }
    final AccountUserResponse response = callLookup(new ExternalIdLookupRequest(externalId));
    return toLocalUser(response);
  }

  private AccountUserResponse callLookup(ExternalIdLookupRequest request) {
    try {
      final AccountUserResponse response =
          accountRestClient
              .post()
              .uri(properties.resolveExternalIdPath())
              .header(properties.internalApiHeaderName(), properties.internalApiToken())
              .body(request)
              .retrieve()
              .body(AccountUserResponse.class);
      if (response == null) {
        logger.warn("account lookup returned empty body");
        throw new AccountIntegrationException(
            AccountIntegrationException.Reason.INVALID_RESPONSE, "account response is empty");
      }
      return response;
    } catch (RestClientResponseException ex) {
      logger.warn(
          "account lookup failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      if (ex.getStatusCode().value() == 404) {
        throw new UserNotFoundException(
            "user with external id \"" + request.externalId() + "\" not found", ex);
      }
      if (ex.getStatusCode().value() == 401) {
        throw new AccountIntegrationException(
            AccountIntegrationException.Reason.UNAUTHORIZED, "account rejected internal auth", ex);
      }
      if (ex.getStatusCode().value() == 403) {
        throw new AccountIntegrationException(
            AccountIntegrationException.Reason.FORBIDDEN, "account denied access", ex);
      }
      if (ex.getStatusCode().is5xxServerError()) {
        throw new AccountIntegrationException(
            AccountIntegrationException.Reason.BAD_GATEWAY, "account server error", ex);
      }
      throw new AccountIntegrationException(
          AccountIntegrationException.Reason.BAD_GATEWAY, "account request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("account lookup timed out");
        throw new AccountIntegrationException(
            AccountIntegrationException.Reason.TIMEOUT, "account request timeout", ex);
      }
      logger.warn("account lookup connection failed", ex);
      throw new AccountIntegrationException(
          AccountIntegrationException.Reason.BAD_GATEWAY, "account connection failed", ex);
    } catch (AccountIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("account lookup response parse failed", ex);
      throw new AccountIntegrationException(
          AccountIntegrationException.Reason.INVALID_RESPONSE, "account response parse failed", ex);
    }
  }

  private LocalUser toLocalUser(AccountUserResponse response) {
    if (isBlank(response.userId()) || isBlank(response.accountStatus())) {
      logger.warn("account lookup response validation failed");
      throw new AccountIntegrationException(
          AccountIntegrationException.Reason.INVALID_RESPONSE, "account response is invalid");
    }
    return new LocalUser(
        response.userId(), response.username(), response.accountStatus(), response.roles());
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
