package com.autonomous.dashboard.config;

import com.autonomous.dashboard.gateway.GatewayClient;
import com.autonomous.dashboard.gateway.GatewayJson;
import com.autonomous.dashboard.gateway.TransportSession;
import com.autonomous.dashboard.gateway.WebSocketTransportSession;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService gatewayScheduler() {
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "clawdbot-gateway");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public WebSocketClient gatewayWebSocketClient(GatewayProperties properties) {
        // Config snapshots exceed the container's 8KB default text buffer
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(properties.getMaxTextMessageSize());
        return new StandardWebSocketClient(container);
    }

    @Bean
    public TransportSession gatewayTransport(WebSocketClient gatewayWebSocketClient, GatewayProperties properties) {
        return new WebSocketTransportSession(gatewayWebSocketClient, properties.getMaxTextMessageSize());
    }

    @Bean(destroyMethod = "disconnect")
    public GatewayClient gatewayClient(GatewayProperties properties, TransportSession gatewayTransport,
                                       @Qualifier("gatewayScheduler") ScheduledExecutorService gatewayScheduler) {
        return new GatewayClient(properties, gatewayTransport, gatewayScheduler, GatewayJson.newObjectMapper());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void connectOnStartup(ApplicationReadyEvent event) {
        GatewayProperties properties = event.getApplicationContext().getBean(GatewayProperties.class);
        if (!properties.isAutoConnect()) {
            return;
        }
        GatewayClient client = event.getApplicationContext().getBean(GatewayClient.class);
        client.connect().whenComplete((hello, error) -> {
            if (error != null) {
                log.warn("Initial gateway connection failed: {}", error.getMessage());
            }
        });
    }
}
