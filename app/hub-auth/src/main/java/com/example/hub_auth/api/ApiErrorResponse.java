package com.example.hub_auth.api;

public record ApiErrorResponse(String code, String message) {}
