package com.meetrelay.server.media;

public class RoomNotFoundException extends RuntimeException {

    private final String roomName;

    public RoomNotFoundException(String roomName) {
        super("Room '" + roomName + "' not found");
        this.roomName = roomName;
    }

    public String getRoomName() {
        return roomName;
    }
}
