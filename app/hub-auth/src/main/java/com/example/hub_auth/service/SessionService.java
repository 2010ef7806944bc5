package com.example.hub_auth.service;

import com.example.hub_auth.config.SessionProperties;
import com.example.hub_auth.model.HubSession;
import com.example.hub_auth.model.HubUser;
import com.example.hub_auth.model.SpawnerState;
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
  private final SessionProperties properties;
  private final SpawnerStateCodec spawnerStateCodec;
  private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

  public String createSession(HubUser user) {
    if (user == null || user.name() == null || user.name().isBlank()) {
      throw new IllegalArgumentException("user is required");
    }
    final Instant now = Instant.now(clock);
    // 再参照されない期限切れセッションもここで掃除する
    sessions.values().removeIf(entry -> entry.isExpiredAt(now));
    final String sessionId = UUID.randomUUID().toString();
    final Map<String, Object> state =
        spawnerStateCodec.save(SpawnerState.fromAuthState(user.authorizationState()));
    sessions.put(
        sessionId,
        new SessionEntry(user.name(), state, now.plus(properties.ttl())));
    return sessionId;
  }

  public Optional<HubSession> findSession(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    final SessionEntry entry = sessions.get(sessionId);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpiredAt(Instant.now(clock))) {
      sessions.remove(sessionId);
      return Optional.empty();
    }
    return Optional.of(
        new HubSession(sessionId, entry.userName(), spawnerStateCodec.load(entry.spawnerState())));
  }

  public void deleteSession(String sessionId) {
    if (sessionId != null) {
      sessions.remove(sessionId);
    }
  }

  int sessionCount() {
    return sessions.size();
  }

  private record SessionEntry(
      String userName, Map<String, Object> spawnerState, Instant expiresAt) {

    boolean isExpiredAt(Instant now) {
      return expiresAt.isBefore(now);
    }
  }
}
