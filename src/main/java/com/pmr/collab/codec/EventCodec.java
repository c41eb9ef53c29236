package com.pmr.collab.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pmr.collab.dto.EventEnvelope;
import com.pmr.collab.dto.HeartbeatPayload;
import com.pmr.collab.dto.WirePayload;
import com.pmr.collab.exception.DecodeException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;

/**
 * Converts between {@link CollabEvent}s and JSON text frames.
 * Unknown tags decode to empty so newer servers can add event kinds.
 */
@Slf4j
public class EventCodec {
    private final ObjectMapper mapper;

    public EventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public String encode(EventType type, String userId, Instant timestamp, WirePayload payload) {
        WirePayload body = payload != null ? payload : new HeartbeatPayload();
        EventEnvelope envelope = new EventEnvelope(type.getWireName(), userId, timestamp, mapper.valueToTree(body));
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + type.getWireName() + " event", e);
        }
    }

    /**
     * @return the decoded event, or empty if its tag is not a known event kind
     * @throws DecodeException if the frame is not valid JSON or the payload does not fit its kind
     */
    public Optional<CollabEvent> decode(String frame) {
        EventEnvelope envelope;
        try {
            envelope = mapper.readValue(frame, EventEnvelope.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DecodeException("Frame is not a valid event envelope", e);
        }
        if (envelope == null || envelope.getType() == null) {
            throw new DecodeException("Frame has no event type");
        }

        Optional<EventType> type = EventType.fromWireName(envelope.getType());
        if (type.isEmpty()) {
            log.debug("Ignoring unknown event type '{}'", envelope.getType());
            return Optional.empty();
        }
        WirePayload payload = readPayload(type.get(), envelope.getData());
        return Optional.of(new CollabEvent(type.get(), envelope.getUserId(), envelope.getTimestamp(), payload));
    }

    private WirePayload readPayload(EventType type, JsonNode data) {
        JsonNode body = data;
        if (body == null || body.isNull() || body.isMissingNode()) {
            if (type != EventType.HEARTBEAT) {
                throw new DecodeException("Missing data for " + type.getWireName() + " event");
            }
            body = mapper.createObjectNode();
        }
        if (!body.isObject()) {
            throw new DecodeException("Data of " + type.getWireName() + " event is not an object");
        }
        try {
            WirePayload payload = mapper.treeToValue(body, type.getPayloadType());
            payload.validate();
            return payload;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DecodeException("Malformed " + type.getWireName() + " payload: " + e.getMessage(), e);
        }
    }
}
