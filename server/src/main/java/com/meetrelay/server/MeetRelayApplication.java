package com.meetrelay.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetRelayApplication.class, args);
    }
}
