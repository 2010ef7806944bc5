package com.example.hub_auth.model;

public record ProjectGrant(String name, String username) {}
