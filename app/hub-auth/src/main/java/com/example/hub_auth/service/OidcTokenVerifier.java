package com.example.hub_auth.service;

import com.example.hub_auth.model.OidcClaims;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.SignedJWT;
import java.security.Key;
import java.text.ParseException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OidcTokenVerifier {

  private static final Logger logger = LoggerFactory.getLogger(OidcTokenVerifier.class);

  static final List<String> REQUIRED_CLAIMS =
      List.of("aud", "exp", "iss", "iat", "short_name", "projects");

  private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();
  private final Clock clock;

  /**
   * 役割:
   * - 解決済みの署名鍵で id_token を検証し、claims を返す。
   *
   * 期待動作:
   * - iat > now + leeway は未発効、exp <= now - leeway は期限切れとして 401。
   * - iss は完全一致、aud は文字列または配列で audience を含むこと。
   */
  public OidcClaims verify(
      String token,
      JWK signingKey,
      Collection<String> allowedAlgorithms,
      String audience,
      String issuer,
      double leewaySeconds) {
    if (signingKey == null) {
      throw new IllegalArgumentException("signingKey is required");
    }
    if (allowedAlgorithms == null || allowedAlgorithms.isEmpty()) {
      throw new IllegalArgumentException("allowedAlgorithms is required");
    }
    final SignedJWT jwt = parse(token);
    verifySignature(jwt, signingKey, allowedAlgorithms);

    final Map<String, Object> payload = jwt.getPayload().toJSONObject();
    if (payload == null) {
      throw invalid("Invalid payload");
    }
    for (String claim : REQUIRED_CLAIMS) {
      if (payload.get(claim) == null) {
        throw invalid("Token is missing the \"" + claim + "\" claim");
      }
    }

    final double now = clock.millis() / 1000.0d;
    final long issuedAt = integerClaim(payload, "iat", "Issued At claim (iat) must be an integer.");
    if (issuedAt > now + leewaySeconds) {
      throw invalid("The token is not yet valid (iat)");
    }
    if (payload.get("nbf") != null) {
      final long notBefore =
          integerClaim(payload, "nbf", "Not Before claim (nbf) must be an integer.");
      if (notBefore > now + leewaySeconds) {
        throw invalid("The token is not yet valid (nbf)");
      }
    }
    final long expiresAt =
        integerClaim(payload, "exp", "Expiration Time claim (exp) must be an integer.");
    if (expiresAt <= now - leewaySeconds) {
      throw invalid("Signature has expired");
    }

    final Object iss = payload.get("iss");
    if (!(iss instanceof String tokenIssuer) || !tokenIssuer.equals(issuer)) {
      throw invalid("Invalid issuer");
    }
    final List<String> tokenAudience = audience(payload.get("aud"));
    if (!tokenAudience.contains(audience)) {
      throw invalid("Audience doesn't match");
    }

    final Object shortName = payload.get("short_name");
    return new OidcClaims(
        tokenIssuer,
        tokenAudience,
        issuedAt,
        expiresAt,
        shortName instanceof String value ? value : null,
        payload.get("projects"));
  }

  private SignedJWT parse(String token) {
    if (token == null || token.isBlank()) {
      throw invalid("token is empty");
    }
    try {
      return SignedJWT.parse(token);
    } catch (ParseException ex) {
      logger.warn("id_token parse failed: {}", ex.getMessage());
      throw invalid("Invalid token format");
    }
  }

  private void verifySignature(
      SignedJWT jwt, JWK signingKey, Collection<String> allowedAlgorithms) {
    // alg はトークン自身の申告ではなく provider が公開した許可リストで判定する
    final JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
    if (!allowedAlgorithms.contains(algorithm.getName())) {
      throw invalid("The specified alg value is not allowed");
    }
    try {
      final JWSVerifier verifier =
          verifierFactory.createJWSVerifier(jwt.getHeader(), toVerificationKey(signingKey));
      if (!jwt.verify(verifier)) {
        throw invalid("Signature verification failed");
      }
    } catch (JOSEException ex) {
      logger.warn("id_token signature check failed: {}", ex.getMessage());
      throw invalid("Signature verification failed");
    }
  }

  private Key toVerificationKey(JWK signingKey) throws JOSEException {
    if (signingKey instanceof RSAKey rsaKey) {
      return rsaKey.toRSAPublicKey();
    }
    if (signingKey instanceof ECKey ecKey) {
      return ecKey.toECPublicKey();
    }
    if (signingKey instanceof OctetSequenceKey octetKey) {
      return octetKey.toSecretKey();
    }
    throw new JOSEException("Unsupported signing key type: " + signingKey.getKeyType());
  }

  private long integerClaim(Map<String, Object> payload, String claim, String message) {
    if (payload.get(claim) instanceof Number number) {
      return number.longValue();
    }
    throw invalid(message);
  }

  private List<String> audience(Object aud) {
    if (aud instanceof String value) {
      return List.of(value);
    }
    if (aud instanceof List<?> values && values.stream().allMatch(String.class::isInstance)) {
      return values.stream().map(String.class::cast).toList();
    }
    throw invalid("Invalid claim format in token");
  }

  private TokenAuthenticationException invalid(String reason) {
    return new TokenAuthenticationException("Invalid JWT token: " + reason);
  }
}
