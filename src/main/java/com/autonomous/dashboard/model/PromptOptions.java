package com.autonomous.dashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PromptOptions {
    private String organizationName;
    private String groupName;
    private String purpose;
    private String language;                  // wins over personality.language
    private String additionalInstructions;

    public static PromptOptions none() {
        return PromptOptions.builder().build();
    }
}
