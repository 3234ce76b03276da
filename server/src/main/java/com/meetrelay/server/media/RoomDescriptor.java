package com.meetrelay.server.media;

public record RoomDescriptor(
        String name,
        String sid,
        int numParticipants,
        int maxParticipants,
        long creationTime,   // epoch seconds
        String metadata
) {}
