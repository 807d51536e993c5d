package io.github.samzhu.trafficledger.cache;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 單一資源的告警狀態資料，以 JSON 儲存。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlertStateData(
    @JsonProperty("state") AlertState state,
    @JsonProperty("fired_at") Instant firedAt,
    @JsonProperty("last_notified_at") Instant lastNotifiedAt,
    @JsonProperty("notify_count") int notifyCount
) {
    public static AlertStateData firing(Instant now) {
        return new AlertStateData(AlertState.FIRING, now, now, 1);
    }

    public AlertStateData notified(Instant now) {
        return new AlertStateData(state, firedAt, now, notifyCount + 1);
    }
}
