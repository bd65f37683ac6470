package com.autonomous.dashboard.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClientInfo {
    private String id;
    private String version;
    private String platform;
    private String mode;            // operator | node
    private String displayName;
    private String instanceId;
}
