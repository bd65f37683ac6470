package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectParams {
    private int minProtocol;
    private int maxProtocol;
    private ClientInfo client;
    private String role;            // operator | node
    private List<String> scopes;
    private Map<String, String> auth;
    private String locale;
    private String userAgent;
}
