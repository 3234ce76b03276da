package com.meetrelay.server.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiveKitConfigTest {

    @Test
    void missingCredentialsAreNamed() {
        assertThatThrownBy(() -> LiveKitConfig.validate("", "key", " "))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Missing required environment variables: LIVEKIT_API_SECRET, LIVEKIT_URL");
    }

    @Test
    void completeCredentialsPass() {
        assertThatCode(() -> LiveKitConfig.validate("wss://lk.example", "key", "secret"))
                .doesNotThrowAnyException();
    }

    @Test
    void managementHostUsesHttpScheme() {
        assertThat(LiveKitConfig.toHttpHost("wss://lk.example")).isEqualTo("https://lk.example");
        assertThat(LiveKitConfig.toHttpHost("ws://localhost:7880")).isEqualTo("http://localhost:7880");
        assertThat(LiveKitConfig.toHttpHost("https://lk.example")).isEqualTo("https://lk.example");
    }
}
