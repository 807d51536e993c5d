package io.github.samzhu.trafficledger.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 資源告警（例如節點離線、流量超限）的狀態機。
 *
 * <p>狀態轉換皆為原子操作，多個實例同時偵測到同一事件時只有一個會得到「新觸發」。
 * 狀態資料保留 7 天，避免已刪除資源的狀態永久殘留。
 */
public interface AlertStateManager {

    Duration STATE_TTL = Duration.ofDays(7);

    /**
     * @return 狀態資料；無資料時為 empty（視為正常）
     */
    Optional<AlertStateData> getState(String resourceType, long resourceId);

    /**
     * 轉為觸發狀態。
     *
     * @return true 表示新觸發；已在觸發狀態時為 false
     */
    boolean transitionToFiring(String resourceType, long resourceId, Instant now);

    /**
     * 轉為正常狀態（刪除狀態資料）。
     *
     * @return 原本為觸發狀態時回傳觸發時間，否則為 empty
     */
    Optional<Instant> transitionToNormal(String resourceType, long resourceId);

    /**
     * 是否應重複通知：觸發中且距上次通知已超過間隔。間隔為 0 或負值時停用。
     */
    default boolean shouldRepeatNotify(String resourceType, long resourceId, Duration repeatInterval, Instant now) {
        if (repeatInterval == null || repeatInterval.isZero() || repeatInterval.isNegative()) {
            return false;
        }
        Optional<AlertStateData> state = getState(resourceType, resourceId);
        if (state.isEmpty() || state.get().state() != AlertState.FIRING) {
            return false;
        }
        Instant last = state.get().lastNotifiedAt();
        return last == null || !now.isBefore(last.plus(repeatInterval));
    }

    /**
     * 記錄一次通知；無狀態資料時不做任何事。
     */
    void markNotified(String resourceType, long resourceId, Instant now);

    void clearState(String resourceType, long resourceId);
}
