package com.autonomous.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActivationRequest {
    private Boolean requireMention;     // defaults to true
    private PersonalityConfig personality;
    private FeatureToggles features;
}
