package com.autonomous.dashboard.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RouteResult {

    public enum Stage {
        RECEIVED,
        CONTEXT_RESOLVED,
        RESPONSE_REQUESTED,
        COMPLETED,
        FALLBACK_GENERATED,
        ANALYTICS_RECORDED
    }

    public enum SkipReason {
        SELF_AUTHORED,
        NO_CHANNEL,
        CHANNEL_DISABLED,
        MENTION_REQUIRED
    }

    private boolean processed;
    private boolean responded;
    private Stage stage;
    private SkipReason skipReason;
    private String channelId;
    private String runId;
    private String response;
    private String error;

    public static RouteResult skipped(Stage stage, SkipReason reason, String channelId) {
        return RouteResult.builder()
            .processed(stage != Stage.RECEIVED)
            .responded(false)
            .stage(stage)
            .skipReason(reason)
            .channelId(channelId)
            .build();
    }
}
