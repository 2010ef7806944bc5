package com.example.hub_auth.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({OidcClientProperties.class, BricsPlatformProperties.class})
public class OidcClientConfig {

  @Bean
  RestClient oidcRestClient(RestClient.Builder builder, OidcClientProperties properties) {
    // discovery と JWKS 取得の両方で使う。リトライはしない。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
