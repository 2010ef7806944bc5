package com.example.hub_auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "brics")
public record BricsPlatformProperties(String platform, String homeRoot, String loginShell) {

  public BricsPlatformProperties {
    platform = platform == null || platform.isBlank() ? "brics.aip1.notebooks.shared" : platform;
    homeRoot = homeRoot == null || homeRoot.isBlank() ? "/home" : homeRoot;
    loginShell = loginShell == null || loginShell.isBlank() ? "/bin/bash" : loginShell;
  }
}
