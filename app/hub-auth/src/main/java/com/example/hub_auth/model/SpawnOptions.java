package com.example.hub_auth.model;

// partition / reservation は未入力なら null
public record SpawnOptions(
    String bricsProject, String runtime, String ngpus, String partition, String reservation) {}
