package com.example.identity.service;

import com.example.identity.config.IdentityProperties;
import com.example.identity.model.LocalUser;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionService {

  private final Clock clock;
  private final IdentityProperties properties;
  private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

  public String createSession(LocalUser user) {
    final Instant now = Instant.now(clock);
    // 二度と参照されない期限切れセッションもここで掃除する
    sessions.values().removeIf(entry -> entry.expiresAt().isBefore(now));
    final String sessionId = UUID.randomUUID().toString();
    sessions.put(sessionId, new SessionEntry(user, now.plus(properties.sessionTtl())));
    return sessionId;
  }

  public Optional<LocalUser> findUser(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return Optional.empty();
    }
    final SessionEntry entry = sessions.get(sessionId);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.expiresAt().isBefore(Instant.now(clock))) {
      sessions.remove(sessionId);
      return Optional.empty();
    }
    return Optional.of(entry.user());
  }

  @VisibleForTesting
  int sessionCount() {
    return sessions.size();
  }

  private record SessionEntry(LocalUser user, Instant expiresAt) {}
}
