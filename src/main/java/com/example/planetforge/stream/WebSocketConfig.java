package com.example.planetforge.stream;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    public static final String STREAM_PATH = "/ws/stream";

    @Bean
    public HandlerMapping streamHandlerMapping(StreamWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of(STREAM_PATH, handler), -1);
    }
}
