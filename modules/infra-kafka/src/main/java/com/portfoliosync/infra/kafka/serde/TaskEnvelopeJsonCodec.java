package com.portfoliosync.infra.kafka.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.infra.kafka.contract.TaskEnvelope;
import com.portfoliosync.infra.kafka.errors.InvalidTaskMetadataException;
import java.util.Optional;

/**
 * JSON form of {@link TaskEnvelope}. A body that does not decode is reported as {@link
 * InvalidTaskMetadataException}, which the consumer dead-letters without retrying.
 */
public class TaskEnvelopeJsonCodec {
  private static final String PAYLOAD_FIELD = "payload";

  private final ObjectMapper objectMapper;

  public TaskEnvelopeJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(TaskEnvelope<?> envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot encode task " + envelope.taskType(), ex);
    }
  }

  public <T> TaskEnvelope<T> decode(String json, Class<T> payloadType) {
    if (json == null || json.isBlank()) {
      throw new InvalidTaskMetadataException("Empty task record");
    }
    JavaType envelopeType =
        objectMapper.getTypeFactory().constructParametricType(TaskEnvelope.class, payloadType);
    try {
      return objectMapper.readValue(json, envelopeType);
    } catch (JsonProcessingException ex) {
      throw new InvalidTaskMetadataException(
          "Undecodable " + payloadType.getSimpleName() + " envelope: " + ex.getOriginalMessage(), ex);
    }
  }

  /**
   * The payload of a record whose envelope or headers were rejected, when the payload alone still
   * reads as {@code payloadType}. Lets a dead-lettered sync task still be tied back to its run.
   */
  public <T> Optional<T> readPayload(String json, Class<T> payloadType) {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      JsonNode payload = objectMapper.readTree(json).path(PAYLOAD_FIELD);
      if (!payload.isObject()) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.treeToValue(payload, payloadType));
    } catch (JsonProcessingException ex) {
      return Optional.empty();
    }
  }
}
