package com.meetrelay.server.model;

import java.util.List;

public record RoomInfo(String name, int numParticipants, List<String> participants, long creationTime, String metadata) {}
