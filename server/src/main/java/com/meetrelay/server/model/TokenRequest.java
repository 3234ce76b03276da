package com.meetrelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenRequest {
    @NotBlank
    public String roomName;

    @NotBlank
    public String participantName;

    public String metadata;

    // used only when the room has to be created first
    @Min(1) @Max(10000)
    public Integer maxParticipants;
}
