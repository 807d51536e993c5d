package io.github.samzhu.trafficledger.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.cloud.stream.binder.test.InputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.util.MimeTypeUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.trafficledger.dto.TrafficReport;
import io.github.samzhu.trafficledger.exception.InvalidResourceTypeException;
import io.github.samzhu.trafficledger.model.TrafficEntry;
import io.github.samzhu.trafficledger.service.TrafficBufferService;

/**
 * 以 Spring Cloud Stream Test Binder 驗證流量回報消費者。
 *
 * <p>Agent 以 Structured Mode（application/cloudevents+json）發送，
 * Spring Cloud Stream 解析後 CloudEvent 屬性放在 header，payload 只剩 data。
 * 此測試直接模擬解析後的訊息。
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/spring_integration_test_binder.html">Test Binder</a>
 */
class TrafficReportFunctionTest {

    private static ConfigurableApplicationContext context;
    private static InputDestination inputDestination;
    private static TrafficBufferService mockBufferService;
    private static ObjectMapper objectMapper;

    @BeforeAll
    static void setupContext() {
        mockBufferService = mock(TrafficBufferService.class);

        context = new SpringApplicationBuilder(
            TestChannelBinderConfiguration.getCompleteConfiguration(TestConfig.class))
            .web(WebApplicationType.NONE)
            .run(
                "--spring.cloud.function.definition=trafficReportConsumer",
                "--spring.cloud.stream.default-binder=integration",
                "--spring.jmx.enabled=false"
            );

        inputDestination = context.getBean(InputDestination.class);
        objectMapper = context.getBean(ObjectMapper.class);
    }

    @AfterAll
    static void closeContext() {
        if (context != null) {
            context.close();
        }
    }

    @BeforeEach
    void resetMock() {
        reset(mockBufferService);
    }

    private static Message<byte[]> cloudEvent(byte[] payload) {
        return MessageBuilder.withPayload(payload)
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .setHeader(CloudEventMessageUtils.SOURCE, URI.create("agent://agent-hk-01"))
            .setHeader(CloudEventMessageUtils.TYPE, "io.github.samzhu.traffic.report.v1")
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0")
            .build();
    }

    @Test
    void shouldBufferEveryReportedItem() throws Exception {
        // Given
        TrafficReport report = new TrafficReport("agent-hk-01", Instant.parse("2025-01-07T04:00:05Z"), List.of(
            new TrafficReport.Item(1L, "node", 100L, 1000L, 2000L),
            new TrafficReport.Item(null, "forward_rule", 7L, 5L, 6L)));

        // When
        inputDestination.send(cloudEvent(objectMapper.writeValueAsBytes(report)));

        // Then
        ArgumentCaptor<TrafficEntry> captor = ArgumentCaptor.forClass(TrafficEntry.class);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockBufferService, times(2)).add(captor.capture()));

        assertThat(captor.getAllValues()).containsExactly(
            new TrafficEntry(1L, "node", 100L, 1000L, 2000L),
            // 無訂閱視為 0
            new TrafficEntry(0L, "forward_rule", 7L, 5L, 6L));
    }

    @Test
    void shouldSkipInvalidItemAndKeepTheRest() throws Exception {
        // Given
        doThrow(new InvalidResourceTypeException("bad:type"))
            .when(mockBufferService).add(argThat(entry -> entry.resourceType().contains(":")));
        TrafficReport report = new TrafficReport("agent-hk-01", Instant.parse("2025-01-07T04:00:05Z"), List.of(
            new TrafficReport.Item(1L, "bad:type", 100L, 1L, 1L),
            new TrafficReport.Item(2L, "node", 200L, 3L, 4L)));

        // When
        inputDestination.send(cloudEvent(objectMapper.writeValueAsBytes(report)));

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockBufferService, atLeastOnce()).add(new TrafficEntry(2L, "node", 200L, 3L, 4L)));
    }

    @Configuration
    @EnableAutoConfiguration(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        RedisAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class,
        RabbitAutoConfiguration.class
    })
    @Import(TrafficReportFunction.class)
    static class TestConfig {

        @Bean
        public TrafficBufferService trafficBufferService() {
            return mockBufferService;
        }
    }
}
