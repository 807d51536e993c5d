package io.github.samzhu.trafficledger.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.samzhu.trafficledger.service.ResourceDirectory;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link LedgerProperties} 的型別安全配置綁定，並註冊共用元件：
 * <ul>
 *   <li>{@link Clock} - 所有「現在時間」皆由此取得，測試可替換</li>
 *   <li>{@link BusinessTime} - 營業時區計算</li>
 *   <li>總覽查詢用的執行緒池</li>
 *   <li>預設的 {@link ResourceDirectory}（以 ID 作為名稱）</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class AppConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BusinessTime businessTime(LedgerProperties properties) {
        return BusinessTime.of(properties.timezone());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService trafficQueryExecutor(LedgerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.query().parallelism(), runnable -> {
            Thread thread = new Thread(runnable, "traffic-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceDirectory resourceDirectory() {
        return ResourceDirectory.identity();
    }
}
