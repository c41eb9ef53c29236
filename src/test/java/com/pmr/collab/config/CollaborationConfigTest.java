package com.pmr.collab.config;

import com.pmr.collab.codec.EventCodec;
import com.pmr.collab.service.CollaborationSessionFactory;
import com.pmr.collab.transport.SpringWebSocketTransport;
import com.pmr.collab.transport.Transport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "collab.server-url=ws://collab.internal:9000",
        "collab.remote-conflict-window=250ms"
})
public class CollaborationConfigTest {

    @Autowired
    private CollaborationProperties properties;

    @Autowired
    private Transport transport;

    @Autowired
    private EventCodec codec;

    @Autowired
    private CollaborationSessionFactory factory;

    @Test
    public void testPropertiesBound() {
        assertEquals("ws://collab.internal:9000", properties.getServerUrl());
        assertEquals(Duration.ofMillis(250), properties.getRemoteConflictWindow());
        assertEquals(Duration.ofSeconds(30), properties.getHeartbeatInterval());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(8), Duration.ofSeconds(10)), properties.getReconnectBackoff());
    }

    @Test
    public void testClientBeansWired() {
        assertInstanceOf(SpringWebSocketTransport.class, transport);
        assertNotNull(codec.getMapper());
        assertNotNull(factory);
    }
}
