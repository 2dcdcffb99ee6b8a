package com.portfoliosync.infra.kafka.contract.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliosync.infra.kafka.contract.payload.RunUserAnalyticsTaskV1;
import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.RecordComponent;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class PayloadJsonSchemaContractTest {
  private static final String BASE_PATH = "contracts/payload-schemas/";
  private static final String SYNC_CONNECTOR_SCHEMA = BASE_PATH + "sync-connector-v1.schema.json";
  private static final String RUN_USER_ANALYTICS_SCHEMA =
      BASE_PATH + "run-user-analytics-v1.schema.json";

  private static final Map<Class<? extends Record>, String> PAYLOAD_SCHEMAS =
      Map.of(
          SyncConnectorTaskV1.class, SYNC_CONNECTOR_SCHEMA,
          RunUserAnalyticsTaskV1.class, RUN_USER_ANALYTICS_SCHEMA);

  @Test
  void syncConnectorSchema_shouldAcceptSerializedPayload() {
    JsonSchemaValidatorSupport.assertSerializedValid(
        SYNC_CONNECTOR_SCHEMA,
        new SyncConnectorTaskV1(
                12L, 3L, 44L, "TON_WALLET", "sync_ton", LocalDate.of(2026, 2, 1), 1));
  }

  @Test
  void syncConnectorSchema_shouldRejectUnknownSourceType() {
    String payload =
        """
        {
          "batchId": 12,
          "userId": 3,
          "connectionId": 44,
          "connectionKind": "INTEGRATION",
          "sourceType": "sync_equities",
          "snapshotDate": "2026-02-01",
          "attempt": 1
        }
        """;
    JsonSchemaValidatorSupport.assertInvalid(SYNC_CONNECTOR_SCHEMA, payload, "sourceType");
  }

  @Test
  void syncConnectorSchema_shouldRejectMissingAttempt() {
    String payload =
        """
        {
          "batchId": 12,
          "userId": 3,
          "connectionId": 44,
          "connectionKind": "INTEGRATION",
          "sourceType": "sync_crypto",
          "snapshotDate": "2026-02-01"
        }
        """;
    JsonSchemaValidatorSupport.assertInvalid(SYNC_CONNECTOR_SCHEMA, payload, "required");
  }

  @Test
  void runUserAnalyticsSchema_shouldAcceptSerializedPayload() {
    JsonSchemaValidatorSupport.assertSerializedValid(
        RUN_USER_ANALYTICS_SCHEMA, new RunUserAnalyticsTaskV1(12L, 3L, LocalDate.of(2026, 2, 1)));
  }

  @Test
  void runUserAnalyticsSchema_shouldRejectTimestampAsSnapshotDate() {
    String payload =
        """
        {"batchId": 12, "userId": 3, "snapshotDate": "2026-02-01T00:00:00Z"}
        """;
    JsonSchemaValidatorSupport.assertInvalid(RUN_USER_ANALYTICS_SCHEMA, payload, "snapshotDate");
  }

  @Test
  void schemaPropertiesShouldMatchRecordComponents() throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    for (Map.Entry<Class<? extends Record>, String> entry : PAYLOAD_SCHEMAS.entrySet()) {
      Set<String> components =
          Arrays.stream(entry.getKey().getRecordComponents())
              .map(RecordComponent::getName)
              .collect(Collectors.toSet());
      try (InputStream in = getClass().getClassLoader().getResourceAsStream(entry.getValue())) {
        JsonNode schema = mapper.readTree(in);
        Set<String> properties = new HashSet<>();
        schema.path("properties").fieldNames().forEachRemaining(properties::add);
        assertEquals(components, properties, entry.getValue());
      }
    }
  }
}
