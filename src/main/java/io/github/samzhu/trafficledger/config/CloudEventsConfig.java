package io.github.samzhu.trafficledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>節點 Agent 以 Structured Mode ({@code application/cloudevents+json}) 回報流量，
 * 轉換器將 CloudEvent attributes 轉為 Message Headers，data 反序列化為
 * {@link io.github.samzhu.trafficledger.dto.TrafficReport}。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
