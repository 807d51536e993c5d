package io.github.samzhu.trafficledger.cache;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警狀態。無狀態資料視為 {@link #NORMAL}。
 */
public enum AlertState {

    NORMAL("normal"),
    FIRING("firing");

    private final String value;

    AlertState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
