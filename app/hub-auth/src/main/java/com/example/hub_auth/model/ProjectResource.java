package com.example.hub_auth.model;

public record ProjectResource(String name, String username) {}
