package com.meetrelay.client.config;

public record ClientConfig(
        String baseWsUrl,     // ws://localhost:8000/ws
        int rooms,            // number of rooms, each filled independently
        int peersPerRoom,     // peers joined to every room
        int offersPerPeer,    // offers each peer sends to every other peer in its room
        long timeoutSeconds   // how long to wait for deliveries before giving up
) {
    public ClientConfig {
        if (baseWsUrl == null || !(baseWsUrl.startsWith("ws://") || baseWsUrl.startsWith("wss://"))) {
            throw new IllegalArgumentException("baseWsUrl must start with ws:// or wss://, got " + baseWsUrl);
        }
        if (rooms < 1) throw new IllegalArgumentException("rooms must be >= 1");
        if (peersPerRoom < 1) throw new IllegalArgumentException("peersPerRoom must be >= 1");
        if (offersPerPeer < 0) throw new IllegalArgumentException("offersPerPeer must be >= 0");
        if (timeoutSeconds < 1) throw new IllegalArgumentException("timeoutSeconds must be >= 1");
        baseWsUrl = baseWsUrl.endsWith("/") ? baseWsUrl.substring(0, baseWsUrl.length() - 1) : baseWsUrl;
    }

    public static ClientConfig fromArgs(String[] args) {
        String base = args.length > 0 ? args[0] : "ws://localhost:8000/ws";
        int rms     = args.length > 1 ? Integer.parseInt(args[1]) : 4;
        int peers   = args.length > 2 ? Integer.parseInt(args[2]) : 3;
        int offers  = args.length > 3 ? Integer.parseInt(args[3]) : 10;
        long tmo    = args.length > 4 ? Long.parseLong(args[4]) : 30L;
        return new ClientConfig(base, rms, peers, offers, tmo);
    }

    public String roomId(int room) {
        return "room-" + room;
    }

    public String peerId(int room, int peer) {
        return "peer-" + room + "-" + peer;
    }

    public String url(int room, int peer) {
        return baseWsUrl + "/" + roomId(room) + "/" + peerId(room, peer);
    }

    /** Offers that should reach a peer if every one sent is delivered. */
    public long expectedDeliveries() {
        return (long) rooms * peersPerRoom * (peersPerRoom - 1) * offersPerPeer;
    }
}
