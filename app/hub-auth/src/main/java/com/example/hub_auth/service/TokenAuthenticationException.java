/*
 * どこで: Hub-Auth サービス層
 * 何を: id_token の欠落・鍵解決失敗・署名/claim 検証失敗を表現する
 * なぜ: 認証失敗をすべて 401 へ正規化するため
 */
package com.example.hub_auth.service;

public class TokenAuthenticationException extends RuntimeException {

  public TokenAuthenticationException(String message) {
    super(message);
  }

  public TokenAuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
