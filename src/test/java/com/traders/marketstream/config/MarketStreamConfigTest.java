package com.traders.marketstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.traders.marketstream.application.MarketStreamClientFactory;
import com.traders.marketstream.websocket.WebSocketHub;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarketStreamConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(MarketStreamConfig.class)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new);

    @Test
    @DisplayName("The host keeps its Boot-configured ObjectMapper")
    void leavesHostObjectMapperAlone() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals(1, context.getBeansOfType(ObjectMapper.class).size());

            String json = context.getBean(ObjectMapper.class).writeValueAsString(Map.of("at", Instant.EPOCH));

            assertEquals("{\"at\":\"1970-01-01T00:00:00Z\"}", json);
        });
    }

    @Test
    @DisplayName("Wires the hub and client factory from market.stream properties")
    void wiresStreamingBeans() {
        contextRunner
                .withPropertyValues("market.stream.base-url=wss://stream.example.test", "market.stream.path=/feed")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    WebSocketHub hub = context.getBean(WebSocketHub.class);
                    assertEquals("wss://stream.example.test", hub.getSettings().baseUrl());
                    assertEquals("/feed", hub.getSettings().defaultPath());
                    assertSame(hub, context.getBean(MarketStreamClientFactory.class).getHub());
                });
    }
}
