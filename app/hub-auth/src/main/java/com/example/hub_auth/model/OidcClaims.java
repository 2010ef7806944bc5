/*
 * どこで: app/hub-auth/src/main/java/com/example/hub_auth/model/OidcClaims.java
 * 何を: 署名と必須 claim の検証を通過した id_token の claims
 * なぜ: トークン処理と認可処理を分離してテストしやすくするため
 */
package com.example.hub_auth.model;

import java.util.List;

// projects は IdP が送った生の値のまま保持する (正規化は ProjectsClaimNormalizer)
public record OidcClaims(
    String issuer,
    List<String> audience,
    long issuedAtEpochSeconds,
    long expiresAtEpochSeconds,
    String shortName,
    Object projects) {

  public OidcClaims {
    audience = audience == null ? List.of() : List.copyOf(audience);
  }
}
