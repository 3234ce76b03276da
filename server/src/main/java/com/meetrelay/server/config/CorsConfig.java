package com.meetrelay.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Browser frontends on other origins call the REST API; same origin rules as the signaling endpoint.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${relay.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        for (String path : new String[]{"/api/**", "/health", "/"}) {
            registry.addMapping(path)
                    .allowedOriginPatterns(allowedOrigins)
                    .allowedMethods("*")
                    .allowedHeaders("*")
                    .allowCredentials(true);
        }
    }
}
