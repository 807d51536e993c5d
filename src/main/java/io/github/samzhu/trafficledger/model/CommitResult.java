package io.github.samzhu.trafficledger.model;

/**
 * flush 標記提交結果。
 */
public enum CommitResult {

    /** 標記已更新且無新增量，已自待處理索引移除 */
    SETTLED,

    /** 標記已更新，但 flush 期間有新增量，保留於待處理索引 */
    ADVANCED,

    /** 計數已不存在（過期或被清除），已自待處理索引移除 */
    VANISHED
}
