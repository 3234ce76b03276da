package com.meetrelay.client.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Targeted offer frames; {@code data.sentAt} is the sender's {@link System#nanoTime()}.
 */
public class OfferFactory {

    public static final String OFFER = "offer";
    public static final String SENT_AT = "sentAt";

    // Session descriptions vary in size so frames are not all identical
    private static final String[] SDP_POOL = {
            "v=0\r\no=- 0 0 IN IP4 127.0.0.1\r\ns=-\r\nt=0 0\r\n",
            "v=0\r\no=- 1 1 IN IP4 127.0.0.1\r\ns=-\r\nt=0 0\r\nm=audio 9 UDP/TLS/RTP/SAVPF 111\r\n",
            "v=0\r\no=- 2 2 IN IP4 127.0.0.1\r\ns=-\r\nt=0 0\r\nm=audio 9 UDP/TLS/RTP/SAVPF 111\r\n"
                    + "m=video 9 UDP/TLS/RTP/SAVPF 96\r\n"
    };

    private final ObjectMapper mapper;

    public OfferFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String offer(String from, String target, int seq) {
        ObjectNode msg = mapper.createObjectNode();
        msg.put("type", OFFER);
        msg.put("from", from);
        msg.put("target", target);
        ObjectNode data = msg.putObject("data");
        data.put("sdp", SDP_POOL[ThreadLocalRandom.current().nextInt(SDP_POOL.length)]);
        data.put("seq", seq);
        data.put(SENT_AT, System.nanoTime());
        try {
            return mapper.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not encode offer from " + from, e);
        }
    }
}
