package com.autonomous.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroupConfig {

    // Mention gating
    @Builder.Default
    private boolean requireMention = true;
    private List<String> mentionPatterns;

    // Response behavior
    @Builder.Default
    private boolean enabled = true;
    private Integer historyLimit;

    private PersonalityConfig personality;
    private String agentId;
    private String systemPrompt;

    private RateLimitConfig rateLimit;
    private FeatureToggles features;
}
