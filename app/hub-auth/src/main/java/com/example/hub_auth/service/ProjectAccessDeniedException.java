/*
 * どこで: Hub-Auth サービス層
 * 何を: 現在の platform で使える project が 1 件もないログインを表現する
 * なぜ: 検証済みでも利用可能 project が空のユーザーを 403 へ正規化するため
 */
package com.example.hub_auth.service;

public class ProjectAccessDeniedException extends RuntimeException {

  public ProjectAccessDeniedException(String message) {
    super(message);
  }
}
