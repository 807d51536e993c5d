package io.github.samzhu.trafficledger.exception;

/**
 * 儲存層暫時不可用（網路中斷、逾時、連線池耗盡等）。
 *
 * <p>處理方式依儲存層而不同：
 * <ul>
 *   <li>{@link Tier#HOT} - 分析查詢時降級為 0，記錄 warn</li>
 *   <li>{@link Tier#COLD} - 分析查詢直接失敗；壓縮流程保留 key 等待下次重試</li>
 * </ul>
 */
public class TierUnavailableException extends TrafficLedgerException {

    /**
     * 發生錯誤的儲存層。
     */
    public enum Tier {
        HOT,
        COLD
    }

    private final Tier tier;

    public TierUnavailableException(Tier tier, String message, Throwable cause) {
        super(String.format("%s tier unavailable: %s", tier, message), cause);
        this.tier = tier;
    }

    public Tier getTier() {
        return tier;
    }
}
