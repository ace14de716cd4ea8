package com.smpost.infrastructure.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.smpost.domain.error.UnknownEventTypeException;
import com.smpost.domain.event.PostEvent;
import com.smpost.infrastructure.exception.EventSerializationException;
import org.springframework.stereotype.Component;

/**
 * JSON codec for post events, shared by the event store and the Kafka adapters.
 * <p>
 * The discriminator must survive the round trip exactly: an unknown or missing {@code type}
 * is reported as {@link UnknownEventTypeException}, never mapped to a default kind.
 */
@Component
public class EventSerializer {

    private final ObjectMapper mapper;

    public EventSerializer(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .addMixIn(PostEvent.class, PostEventMixin.class);
    }

    /**
     * @throws EventSerializationException if the event cannot be written
     */
    public String serialize(PostEvent event) {
        try {
            return mapper.writerFor(PostEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                "Failed to serialize " + event.eventType() + " for aggregate " + event.aggregateId(), e);
        }
    }

    /**
     * @throws UnknownEventTypeException if the discriminator names no known kind
     * @throws EventSerializationException if the payload is not a well-formed event
     */
    public PostEvent deserialize(String json) {
        try {
            return mapper.readValue(json, PostEvent.class);
        } catch (InvalidTypeIdException e) {
            throw new UnknownEventTypeException(String.valueOf(e.getTypeId()), e);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event payload", e);
        }
    }
}
