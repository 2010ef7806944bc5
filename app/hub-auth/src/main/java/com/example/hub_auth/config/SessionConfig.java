/*
 * どこで: app/hub-auth/src/main/java/com/example/hub_auth/config/SessionConfig.java
 * 何を: セッションと Cookie の設定値をバインドする設定クラス
 * なぜ: TTL/Cookie 属性を環境ごとに切替可能にするため
 */
package com.example.hub_auth.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class SessionConfig {}
