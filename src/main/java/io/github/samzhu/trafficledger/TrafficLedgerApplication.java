package io.github.samzhu.trafficledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Traffic Ledger - 節點與轉發規則的位元組流量帳本。
 *
 * <p>架構流程：
 * <pre>
 * Node Agent → RabbitMQ → TrafficReportFunction → 緩衝 → 熱資料層 (Redis, 小時桶)
 *                                                          ↓ 每分鐘壓縮
 *                                                    冷資料層 (MongoDB traffic_usage)
 *
 * 分析查詢 = 熱資料層 [保留期內] + 冷資料層 [保留期前]
 * </pre>
 */
@SpringBootApplication
@EnableScheduling
public class TrafficLedgerApplication {

    private static final Logger log = LoggerFactory.getLogger(TrafficLedgerApplication.class);

    public static void main(String[] args) {
        log.info("Starting Traffic Ledger");
        SpringApplication.run(TrafficLedgerApplication.class, args);
    }
}
