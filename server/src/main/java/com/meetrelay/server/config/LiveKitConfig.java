package com.meetrelay.server.config;

import com.meetrelay.server.media.LiveKitRoomService;
import com.meetrelay.server.media.RoomService;
import io.livekit.server.RoomServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the LiveKit management client. Startup fails when any of
 * LIVEKIT_URL, LIVEKIT_API_KEY or LIVEKIT_API_SECRET is missing.
 */
@Configuration
public class LiveKitConfig {
    private static final Logger log = LoggerFactory.getLogger(LiveKitConfig.class);

    @Value("${livekit.url:}")
    private String url;

    @Value("${livekit.api.key:}")
    private String apiKey;

    @Value("${livekit.api.secret:}")
    private String apiSecret;

    @Bean
    public RoomServiceClient roomServiceClient() {
        validate(url, apiKey, apiSecret);
        String host = toHttpHost(url);
        log.info("[BOOT] LiveKit management API at {}", host);
        return RoomServiceClient.createClient(host, apiKey, apiSecret);
    }

    @Bean
    public RoomService roomService(RoomServiceClient roomServiceClient) {
        return new LiveKitRoomService(roomServiceClient, url, apiKey, apiSecret);
    }

    static void validate(String url, String apiKey, String apiSecret) {
        List<String> missing = new ArrayList<>();
        if (isBlank(apiKey)) missing.add("LIVEKIT_API_KEY");
        if (isBlank(apiSecret)) missing.add("LIVEKIT_API_SECRET");
        if (isBlank(url)) missing.add("LIVEKIT_URL");
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required environment variables: " + String.join(", ", missing));
        }
    }

    /** The management API speaks HTTP even when clients are given a ws(s) URL. */
    static String toHttpHost(String url) {
        if (url.startsWith("wss://")) return "https://" + url.substring("wss://".length());
        if (url.startsWith("ws://")) return "http://" + url.substring("ws://".length());
        return url;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
