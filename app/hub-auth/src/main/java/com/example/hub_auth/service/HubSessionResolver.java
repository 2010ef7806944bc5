package com.example.hub_auth.service;

import com.example.hub_auth.model.HubSession;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

// 認証 principal をハブセッションへ解決する。
@Service
public class HubSessionResolver {

  public HubSession resolve(Authentication authentication) {
    if (authentication == null || !(authentication.getPrincipal() instanceof HubSession session)) {
      throw new InvalidSessionException("hub session is required");
    }
    return session;
  }
}
