package com.meetrelay.server.media;

public record ParticipantDescriptor(
        String identity,
        String name,
        String sid,
        String state,
        long joinedAt,
        String metadata,
        Permission permission
) {
    public record Permission(boolean canPublish, boolean canSubscribe, boolean canPublishData) {}
}
