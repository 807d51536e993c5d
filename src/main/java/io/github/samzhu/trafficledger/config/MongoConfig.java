package io.github.samzhu.trafficledger.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置（冷資料層）。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code traffic_usage} - 每小時、每訂閱、每資源一筆的流量彙總</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.trafficledger.repository")
public class MongoConfig {
}
