package com.adpulse.alerts.model;

import com.adpulse.alerts.model.detail.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlertDetailJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serialize_writesKindDiscriminator() throws Exception {
        AlertDetail detail = new BurnRateDetail(1600, 1000, 3000, 4800, 1800, 10, 30);

        JsonNode json = objectMapper.readTree(objectMapper.writerFor(AlertDetail.class).writeValueAsString(detail));

        assertThat(json.get("kind").asText()).isEqualTo("BURN_RATE");
        assertThat(json.get("projectedOverspend").asDouble()).isEqualTo(1800.0);
        assertThat(json.has("type")).isFalse();
    }

    @Test
    void deserialize_nestedWeeklySeries() throws Exception {
        String json = "{\"kind\":\"CTR_DECLINE\",\"consecutiveWeeks\":3,\"overallDropPercent\":25.2,"
                + "\"weeklyCtr\":[{\"period\":\"2026-W41\",\"ctr\":0.0206},{\"period\":\"2026-W40\",\"ctr\":0.0243}]}";

        AlertDetail detail = objectMapper.readValue(json, AlertDetail.class);

        assertThat(detail).isInstanceOf(CtrDeclineDetail.class);
        assertThat(detail.type()).isEqualTo(AlertType.CTR_DECLINE);
        CtrDeclineDetail ctr = (CtrDeclineDetail) detail;
        assertThat(ctr.weeklyCtr()).containsExactly(
                new CtrDeclineDetail.WeeklyCtr("2026-W41", 0.0206),
                new CtrDeclineDetail.WeeklyCtr("2026-W40", 0.0243));
    }

    @Test
    void eachDetailReportsItsAlertType() {
        List<AlertDetail> details = List.of(
                new RoasDropDetail(40, 1800, 1000),
                new CpaHighDetail(33, 15, 1000),
                new BudgetLossDetail(45, 8000, 480, 100.0),
                new RankingLossDetail(55, 8000, 240, 2.0),
                new CtrDeclineDetail(3, 25, List.of()),
                new BurnRateDetail(1600, 1000, 3000, 4800, 1800, 10, 30));

        assertThat(details).extracting(AlertDetail::type).containsExactly(AlertType.values());
    }
}
