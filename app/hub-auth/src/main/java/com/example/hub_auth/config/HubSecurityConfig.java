package com.example.hub_auth.config;

import com.example.hub_auth.service.SessionService;
import jakarta.servlet.http.Cookie;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.logout.HttpStatusReturningLogoutSuccessHandler;

@Configuration
public class HubSecurityConfig {
  private final boolean csrfEnabled;

  public HubSecurityConfig(@Value("${app.security.csrf-enabled:true}") boolean csrfEnabled) {
    this.csrfEnabled = csrfEnabled;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, SessionService sessionService, SessionProperties sessionProperties)
      throws Exception {
    if (csrfEnabled) {
      http.csrf(Customizer.withDefaults());
    } else {
      http.csrf(csrf -> csrf.disable());
    }
    http.sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
        .addFilterBefore(
            new SessionCookieAuthenticationFilter(sessionService, sessionProperties.cookieName()),
            AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/login",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/v1/**")
                    .authenticated()
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint()))
        .logout(
            logout ->
                logout
                    .logoutUrl("/logout")
                    .addLogoutHandler(
                        (request, response, authentication) -> {
                          final Cookie[] cookies = request.getCookies();
                          if (cookies == null) {
                            return;
                          }
                          for (Cookie cookie : cookies) {
                            if (sessionProperties.cookieName().equals(cookie.getName())) {
                              sessionService.deleteSession(cookie.getValue());
                            }
                          }
                        })
                    .logoutSuccessHandler(
                        new HttpStatusReturningLogoutSuccessHandler(HttpStatus.NO_CONTENT))
                    .invalidateHttpSession(true)
                    .deleteCookies(sessionProperties.cookieName(), "JSESSIONID"));

    return http.build();
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint() {
    return new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED);
  }
}
