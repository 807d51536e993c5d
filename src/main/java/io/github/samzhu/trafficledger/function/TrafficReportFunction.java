package io.github.samzhu.trafficledger.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.trafficledger.dto.TrafficReport;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.model.TrafficEntry;
import io.github.samzhu.trafficledger.service.TrafficBufferService;

/**
 * CloudEvents 流量回報消費者函式配置。
 *
 * <p>節點 Agent 以 Structured Mode 發送 {@link TrafficReport}，
 * 每個 item 驗證後加入 {@link TrafficBufferService}；不合法的 item 記錄後略過，
 * 不影響同一回報中的其他 item。
 *
 * <p>Binding name: {@code trafficReportConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class TrafficReportFunction {

    private static final Logger log = LoggerFactory.getLogger(TrafficReportFunction.class);

    private final TrafficBufferService bufferService;

    public TrafficReportFunction(TrafficBufferService bufferService) {
        this.bufferService = bufferService;
    }

    /**
     * 錯誤處理：不重新拋出例外，避免訊息重複投遞迴圈。
     */
    @Bean
    public Consumer<Message<TrafficReport>> trafficReportConsumer() {
        return message -> {
            try {
                TrafficReport report = message.getPayload();
                log.debug("CloudEvent received: id={}, type={}, agentId={}, items={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    report.agentId(),
                    report.items().size());

                int accepted = 0;
                for (TrafficReport.Item item : report.items()) {
                    try {
                        bufferService.add(toEntry(item));
                        accepted++;
                    } catch (ValidationException e) {
                        log.warn("Skipping invalid traffic item from agent {}: {}", report.agentId(), e.getMessage());
                    }
                }
                log.debug("Traffic report consumed: agentId={}, accepted={}/{}",
                    report.agentId(), accepted, report.items().size());
            } catch (Exception e) {
                log.error("Failed to process CloudEvent: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
            }
        };
    }

    static TrafficEntry toEntry(TrafficReport.Item item) {
        long subscriptionId = item.subscriptionId() == null ? 0L : item.subscriptionId();
        return new TrafficEntry(subscriptionId, item.resourceType(), item.resourceId(),
            item.uploadBytes(), item.downloadBytes());
    }
}
