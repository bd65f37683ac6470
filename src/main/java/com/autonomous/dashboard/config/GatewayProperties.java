package com.autonomous.dashboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "clawdbot.gateway")
public class GatewayProperties {

    private String url = "ws://127.0.0.1:18789";
    private String token = "";

    // Identity sent in the connect handshake
    private String clientId = "baas-dashboard";
    private String clientVersion = "1.0.0";
    private String displayName = "BaaS Dashboard";
    private String role = "operator";
    private List<String> scopes = new ArrayList<>(List.of("operator.read", "operator.write"));
    private String locale = "en-US";

    private boolean autoConnect = false;
    private boolean autoReconnect = true;

    private Duration connectTimeout = Duration.ofSeconds(30);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration reconnectBaseDelay = Duration.ofSeconds(5);
    private int maxReconnectAttempts = 5;

    // Key under config.channels that holds the group roster
    private String channelKey = "whatsapp";

    private int maxTextMessageSize = 512 * 1024;
}
