package com.example.hub_auth.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OidcDiscoveryDocument(
    @JsonProperty("id_token_signing_alg_values_supported") List<String> signingAlgorithms,
    @JsonProperty("jwks_uri") String jwksUri) {}
