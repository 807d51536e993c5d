package io.github.samzhu.trafficledger.exception;

/**
 * 流量帳本的基底例外。
 *
 * <p>所有帳本相關錯誤皆為 unchecked，呼叫端可依子類別決定處理方式：
 * <ul>
 *   <li>{@link ValidationException} - 輸入不合法，不可重試</li>
 *   <li>{@link ResourceNotFoundException} - 資源已刪除，flush 時應清除快取</li>
 *   <li>{@link TierUnavailableException} - 儲存層暫時不可用，可於下次排程重試</li>
 * </ul>
 */
public class TrafficLedgerException extends RuntimeException {

    public TrafficLedgerException(String message) {
        super(message);
    }

    public TrafficLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
