package com.meetrelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Signaling envelope exchanged over {@code /ws/{roomId}/{userId}}.
 * {@code data} is carried as an opaque JSON value; the relay never looks inside it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalMessage {
    public static final String USER_JOINED = "user-joined";
    public static final String USER_LEFT = "user-left";

    public String type;     // offer, answer, ice-candidate, user-joined, user-left
    public String from;
    public String target;   // absent for broadcasts
    public JsonNode data;

    public SignalMessage() {}

    public SignalMessage(String type, String from) {
        this.type = type;
        this.from = from;
    }

    public static SignalMessage userJoined(String participantId) {
        return new SignalMessage(USER_JOINED, participantId);
    }

    public static SignalMessage userLeft(String participantId) {
        return new SignalMessage(USER_LEFT, participantId);
    }

    public boolean hasTarget() {
        return target != null && !target.isEmpty();
    }

    @Override
    public String toString() {
        return "SignalMessage[type=" + type + ", from=" + from + ", target=" + target + "]";
    }
}
