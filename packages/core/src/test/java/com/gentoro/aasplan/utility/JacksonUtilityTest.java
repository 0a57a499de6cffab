package com.gentoro.aasplan.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.aasplan.access.PlanningConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

class JacksonUtilityTest {

  @Test
  void serializesRecords() throws Exception {
    String json = JacksonUtility.toJson(new PlanningConfig("cell", "deliver", List.of("strips")));

    JsonNode node = JacksonUtility.getJsonMapper().readTree(json);
    assertEquals("cell", node.path("domainName").asText());
    assertEquals("strips", node.path("requirements").get(0).asText());
  }

  @Test
  void ignoresUnknownProperties() throws Exception {
    PlanningConfig config =
        JacksonUtility.getJsonMapper()
            .readValue(
                "{\"domainName\":\"d\",\"problemName\":\"p\",\"requirements\":[],\"extra\":1}",
                PlanningConfig.class);

    assertEquals("d", config.domainName());
  }
}
