package com.example.hub_auth.service;

import com.nimbusds.jose.jwk.JWK;

public interface SigningKeyResolver {

  // 鍵が見つからなければ TokenAuthenticationException、JWKS 取得失敗は OidcIntegrationException
  JWK resolve(String jwksUri, String token);
}
