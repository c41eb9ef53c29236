package com.pmr.collab.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmr.collab.codec.EventCodec;
import com.pmr.collab.transport.SpringWebSocketTransport;
import com.pmr.collab.transport.Transport;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(CollaborationProperties.class)
public class CollaborationConfig {

    @Bean
    public WebSocketClient collaborationWebSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    public Transport collaborationTransport(WebSocketClient collaborationWebSocketClient) {
        return new SpringWebSocketTransport(collaborationWebSocketClient);
    }

    // The codec keeps its own mapper so Spring's web defaults never change the wire format
    @Bean
    public EventCodec eventCodec() {
        ObjectMapper mapper = EventCodec.createObjectMapper();
        return new EventCodec(mapper);
    }

    @Bean
    public Clock collaborationClock() {
        return Clock.systemUTC();
    }
}
