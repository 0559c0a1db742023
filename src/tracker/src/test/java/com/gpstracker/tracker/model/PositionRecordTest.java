package com.gpstracker.tracker.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class PositionRecordTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void serializesUsingWireFieldNames() throws Exception {
    PositionRecord record = new PositionRecord("TEST_001", 40.7128, -74.006, 25.5, 45, 12, 1640995200000L);

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(record));

    assertThat(json.get("device_id").asText()).isEqualTo("TEST_001");
    assertThat(json.get("lat").asDouble()).isEqualTo(40.7128);
    assertThat(json.get("lng").asDouble()).isEqualTo(-74.006);
    assertThat(json.get("speed").asDouble()).isEqualTo(25.5);
    assertThat(json.get("heading").asInt()).isEqualTo(45);
    assertThat(json.get("sats").asInt()).isEqualTo(12);
    assertThat(json.get("timestamp").asLong()).isEqualTo(1640995200000L);
    assertThat(json.has("deviceId")).isFalse();
  }

  @Test
  void streamMessagesOnlyCarryTheirOwnPayloadField() throws Exception {
    PositionRecord record = new PositionRecord("D1", 1.0, 2.0, 0.0, 0, 0, 5L);

    JsonNode update = objectMapper.readTree(objectMapper.writeValueAsString(StreamMessage.update(record)));
    JsonNode snapshot =
        objectMapper.readTree(objectMapper.writeValueAsString(StreamMessage.snapshot(List.of(record))));

    assertThat(update.get("type").asText()).isEqualTo("update");
    assertThat(update.get("device").get("device_id").asText()).isEqualTo("D1");
    assertThat(update.has("devices")).isFalse();
    assertThat(snapshot.get("type").asText()).isEqualTo("snapshot");
    assertThat(snapshot.get("devices")).hasSize(1);
    assertThat(snapshot.has("device")).isFalse();
  }
}
