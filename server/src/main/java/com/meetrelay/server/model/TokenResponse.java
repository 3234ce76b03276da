package com.meetrelay.server.model;

public record TokenResponse(String token, String wsUrl, String roomName, String participantName) {}
