package com.creditpath.backend.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.creditpath.backend.dto.anomaly.AnomalyAlertDTO;
import com.creditpath.backend.dto.strategy.RoundDTO;
import com.creditpath.backend.enums.AlertSeverity;
import com.creditpath.backend.enums.AnomalyType;
import com.creditpath.backend.enums.Bureau;
import com.creditpath.backend.enums.StrategyRound;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class DtoJsonSerializationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void enumsSerializeAsLowercaseCodes() throws Exception {
        AnomalyAlertDTO alert = AnomalyAlertDTO.builder()
                .type(AnomalyType.BUREAU_INCONSISTENCY)
                .severity(AlertSeverity.CRITICAL)
                .bureau(Bureau.TRANSUNION)
                .message("Scores differ by 90 points across bureaus")
                .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(alert));

        assertEquals("bureau_inconsistency", json.get("type").asText());
        assertEquals("critical", json.get("severity").asText());
        assertEquals("transunion", json.get("bureau").asText());
    }

    @Test
    void roundsCarryTheirSchedule() throws Exception {
        String json = objectMapper.writeValueAsString(List.of(RoundDTO.from(StrategyRound.REGULATORY_COMPLAINT)));

        JsonNode round = objectMapper.readTree(json).get(0);
        assertEquals(4, round.get("id").asInt());
        assertEquals(60, round.get("waitDays").asInt());
        assertTrue(round.get("terminal").asBoolean());
    }
}
