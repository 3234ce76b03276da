package com.meetrelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateRoomRequest {
    @NotBlank
    public String roomName;

    @Min(1) @Max(10000)
    public Integer maxParticipants;

    public String metadata;
}
