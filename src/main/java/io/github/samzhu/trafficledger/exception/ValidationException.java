package io.github.samzhu.trafficledger.exception;

/**
 * 輸入驗證失敗。
 *
 * <p>例如時間區間顛倒、流量增量為負數、單次回報超過上限等。
 * 驗證一律在寫入前完成，因此拋出此例外時不會有任何部分寫入。
 */
public class ValidationException extends TrafficLedgerException {

    public ValidationException(String message) {
        super(message);
    }
}
