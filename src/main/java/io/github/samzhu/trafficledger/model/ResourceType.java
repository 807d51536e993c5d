package io.github.samzhu.trafficledger.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 已知的資源類型。
 *
 * <p>儲存與傳輸一律使用 {@link #tag()} 字串，保留未來新增類型的彈性；
 * 此列舉僅用於 API 邊界，避免呼叫端拼錯字串。
 */
public enum ResourceType {

    NODE("node"),
    FORWARD_RULE("forward_rule");

    private final String tag;

    ResourceType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<ResourceType> fromTag(String tag) {
        return Arrays.stream(values())
            .filter(t -> t.tag.equals(tag))
            .findFirst();
    }
}
