package com.adpulse.alerts.model.detail;

import com.adpulse.alerts.model.AlertType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Detector-specific context attached to an alert. One implementation per {@link AlertType};
 * the engine never looks inside it, only renderers and the storage codec do.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RoasDropDetail.class, name = "ROAS_DROP"),
        @JsonSubTypes.Type(value = CpaHighDetail.class, name = "CPA_HIGH"),
        @JsonSubTypes.Type(value = BudgetLossDetail.class, name = "BUDGET_LOSS"),
        @JsonSubTypes.Type(value = RankingLossDetail.class, name = "RANKING_LOSS"),
        @JsonSubTypes.Type(value = CtrDeclineDetail.class, name = "CTR_DECLINE"),
        @JsonSubTypes.Type(value = BurnRateDetail.class, name = "BURN_RATE")
})
public interface AlertDetail {

    @JsonIgnore
    AlertType type();
}
