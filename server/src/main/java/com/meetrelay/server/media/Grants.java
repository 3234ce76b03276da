package com.meetrelay.server.media;

/** Capabilities embedded in a join credential. */
public record Grants(boolean roomJoin, boolean canPublish, boolean canSubscribe, boolean canPublishData) {

    public static Grants full() {
        return new Grants(true, true, true, true);
    }
}
