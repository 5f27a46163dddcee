package com.traders.marketstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.traders.marketstream.application.MarketStreamClientFactory;
import com.traders.marketstream.infrastructure.spring.SpringWebSocketTransport;
import com.traders.marketstream.telemetry.MarketTelemetry;
import com.traders.marketstream.telemetry.MicrometerTelemetrySink;
import com.traders.marketstream.util.SingleThreadEventLoop;
import com.traders.marketstream.websocket.WebSocketHub;
import com.traders.marketstream.websocket.WebSocketTransport;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(MarketStreamProperties.class)
public class MarketStreamConfig {

    @Bean(destroyMethod = "close")
    public SingleThreadEventLoop marketStreamLoop() {
        return new SingleThreadEventLoop("market-stream-loop");
    }

    @Bean
    public WebSocketTransport marketStreamTransport() {
        return new SpringWebSocketTransport(new StandardWebSocketClient());
    }

    @Bean
    public WebSocketHub webSocketHub(WebSocketTransport transport, SingleThreadEventLoop marketStreamLoop,
                                     MarketStreamProperties properties) {
        log.info("Market stream hub targeting {}{}", properties.baseUrl(), properties.path());
        return new WebSocketHub(transport, marketStreamLoop, properties.hubSettings());
    }

    @Bean
    public MarketTelemetry marketTelemetry(MeterRegistry meterRegistry) {
        MarketTelemetry telemetry = new MarketTelemetry();
        telemetry.subscribe(new MicrometerTelemetrySink(meterRegistry));
        return telemetry;
    }

    @Bean
    public MarketStreamClientFactory marketStreamClientFactory(WebSocketHub webSocketHub, MarketTelemetry marketTelemetry,
                                                               MarketStreamProperties properties) {
        // private mapper, never published as a bean
        return new MarketStreamClientFactory(webSocketHub, marketTelemetry, new ObjectMapper(), properties.clientSettings());
    }
}
