package com.autonomous.dashboard.service;

import com.autonomous.dashboard.gateway.GatewayClient;
import com.autonomous.dashboard.gateway.protocol.AgentRun;
import com.autonomous.dashboard.gateway.protocol.AgentRunRequest;
import com.autonomous.dashboard.model.Channel;
import com.autonomous.dashboard.model.ChannelContext;
import com.autonomous.dashboard.model.ChannelStatus;
import com.autonomous.dashboard.model.ConversationMessage;
import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.model.InboundMessage;
import com.autonomous.dashboard.model.PersonalityConfig;
import com.autonomous.dashboard.model.RouteResult;
import com.autonomous.dashboard.store.ChannelStore;
import com.autonomous.dashboard.store.ConversationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
public class MessageRouter {

    static final String PORTUGUESE_GREETING = "Olá! Como posso ajudar?";
    static final String ENGLISH_GREETING = "Hello! How can I help you?";

    private static final Pattern PORTUGUESE_CHARACTERS =
        Pattern.compile("[áéíóúãõç]", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern PORTUGUESE_WORDS =
        Pattern.compile("(?<![\\p{L}\\p{N}_])(oi|olá|bom|dia|tarde|noite|obrigado)(?![\\p{L}\\p{N}_])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final GatewayClient gateway;
    private final ChannelStore channelStore;
    private final ConversationStore conversationStore;
    private final ConfigTranslator configTranslator;
    private final PersonalityPresetService presetService;

    public MessageRouter(GatewayClient gateway, ChannelStore channelStore, ConversationStore conversationStore,
                         ConfigTranslator configTranslator, PersonalityPresetService presetService) {
        this.gateway = gateway;
        this.channelStore = channelStore;
        this.conversationStore = conversationStore;
        this.configTranslator = configTranslator;
        this.presetService = presetService;
    }

    public RouteResult route(InboundMessage message, String organizationId) {
        long startTime = System.currentTimeMillis();
        log.debug("Routing message: id={} groupId={} from={} organizationId={}",
            message.getId(), message.getGroupId(), message.getFrom(), organizationId);

        if (message.isFromMe()) {
            return RouteResult.skipped(RouteResult.Stage.RECEIVED, RouteResult.SkipReason.SELF_AUTHORED, null);
        }

        Optional<ChannelContext> resolved = resolveContext(message.conversationKey(), organizationId);
        if (resolved.isEmpty()) {
            log.debug("No channel for {}, skipping", message.conversationKey());
            return RouteResult.skipped(RouteResult.Stage.RECEIVED, RouteResult.SkipReason.NO_CHANNEL, null);
        }
        ChannelContext context = resolved.get();
        String channelId = context.getChannelId();

        if (context.getChannel().getStatus() != ChannelStatus.ACTIVE || !context.getConfig().isEnabled()) {
            log.debug("Bot disabled for channel {}", channelId);
            return RouteResult.skipped(RouteResult.Stage.CONTEXT_RESOLVED, RouteResult.SkipReason.CHANNEL_DISABLED, channelId);
        }

        if (!isAddressed(message, context.getConfig())) {
            log.debug("Mention required but not found in channel {}", channelId);
            return RouteResult.skipped(RouteResult.Stage.CONTEXT_RESOLVED, RouteResult.SkipReason.MENTION_REQUIRED, channelId);
        }

        RouteResult result;
        try {
            result = requestResponse(message, context);
        } catch (RuntimeException e) {
            log.error("Message routing failed for {}", message.getId(), e);
            return RouteResult.builder()
                .processed(true)
                .responded(false)
                .stage(RouteResult.Stage.FALLBACK_GENERATED)
                .channelId(channelId)
                .error(e.getMessage())
                .build();
        }

        long durationMs = System.currentTimeMillis() - startTime;
        log.info("Message processed: channelId={} messageId={} stage={} durationMs={}",
            channelId, message.getId(), result.getStage(), durationMs);

        if (recordAnalytics(context, message, result.getResponse())) {
            result.setStage(RouteResult.Stage.ANALYTICS_RECORDED);
        }
        return result;
    }

    public Optional<ChannelContext> resolveContext(String externalGroupId, String organizationId) {
        if (externalGroupId == null) {
            return Optional.empty();
        }
        return channelStore.findByExternalGroupId(organizationId, externalGroupId)
            .map(this::toContext);
    }

    private ChannelContext toContext(Channel channel) {
        GroupConfig config = channel.getConfig() != null ? channel.getConfig() : configTranslator.defaultGroupConfig();
        PersonalityConfig personality = config.getPersonality() != null
            ? config.getPersonality()
            : presetService.defaultPersonality();
        return ChannelContext.builder()
            .channel(channel)
            .config(config)
            .personality(personality)
            .systemPrompt(buildSystemPrompt(config.getSystemPrompt(), personality))
            .knowledgeBaseId(channel.getKnowledgeBaseId())
            .build();
    }

    public String buildSystemPrompt(String storedPrompt, PersonalityConfig personality) {
        List<String> parts = new ArrayList<>();
        if (storedPrompt != null && !storedPrompt.isBlank()) {
            parts.add(storedPrompt);
        }
        if (personality != null) {
            parts.addAll(configTranslator.personalityDirectives(personality, null));
        }
        return String.join("\n\n", parts);
    }

    boolean isAddressed(InboundMessage message, GroupConfig config) {
        if (!config.isRequireMention() || message.isMention()) {
            return true;
        }
        List<String> patterns = config.getMentionPatterns();
        if (patterns == null || message.getBody() == null) {
            return false;
        }
        String body = message.getBody().toLowerCase(Locale.ROOT);
        return patterns.stream()
            .filter(pattern -> pattern != null && !pattern.isEmpty())
            .anyMatch(pattern -> body.contains(pattern.toLowerCase(Locale.ROOT)));
    }

    private RouteResult requestResponse(InboundMessage message, ChannelContext context) {
        int historyLimit = context.getConfig().getHistoryLimit() != null
            ? context.getConfig().getHistoryLimit()
            : ConfigTranslator.DEFAULT_HISTORY_LIMIT;
        List<ConversationMessage> history = conversationStore.recent(context.getChannelId(), historyLimit);

        try {
            gateway.ensureConnected();
            AgentRun run = gateway.runAgent(AgentRunRequest.builder()
                .message(message.getBody() != null ? message.getBody() : "")
                .to(message.replyTarget())
                .sessionKey(context.getChannelId() + ":" + message.getFrom())
                .agentId(context.getConfig().getAgentId())
                .extraSystemPrompt(withHistory(context.getSystemPrompt(), history))
                .stream(false)
                .build());
            log.debug("Agent run accepted: runId={} status={}", run.getRunId(), run.getStatus());
            return RouteResult.builder()
                .processed(true)
                .responded(true)
                .stage(RouteResult.Stage.COMPLETED)
                .channelId(context.getChannelId())
                .runId(run.getRunId())
                .build();
        } catch (RuntimeException e) {
            log.warn("Agent run failed for channel {}, falling back to greeting: {}", context.getChannelId(), e.getMessage());
        }

        String greeting = fallbackGreeting(message.getBody());
        gateway.sendMessage(message.replyTarget(), greeting, message.getId());
        return RouteResult.builder()
            .processed(true)
            .responded(true)
            .stage(RouteResult.Stage.FALLBACK_GENERATED)
            .channelId(context.getChannelId())
            .response(greeting)
            .build();
    }

    private String withHistory(String systemPrompt, List<ConversationMessage> history) {
        if (history.isEmpty()) {
            return systemPrompt;
        }
        StringBuilder prompt = new StringBuilder(systemPrompt);
        if (prompt.length() > 0) {
            prompt.append("\n\n");
        }
        prompt.append("Recent conversation:");
        for (ConversationMessage turn : history) {
            prompt.append('\n')
                .append(turn.getRole() == ConversationMessage.Role.ASSISTANT ? "assistant" : "user")
                .append(": ")
                .append(turn.getContent());
        }
        return prompt.toString();
    }

    public String fallbackGreeting(String body) {
        String text = body != null ? body : "";
        boolean portuguese = PORTUGUESE_CHARACTERS.matcher(text).find() || PORTUGUESE_WORDS.matcher(text).find();
        return portuguese ? PORTUGUESE_GREETING : ENGLISH_GREETING;
    }

    private boolean recordAnalytics(ChannelContext context, InboundMessage message, String response) {
        try {
            Instant now = Instant.now();
            channelStore.update(context.getChannelId(), channel -> channel.toBuilder().lastMessageAt(now).build());
            conversationStore.append(context.getChannelId(),
                new ConversationMessage(ConversationMessage.Role.USER, message.getFrom(), message.getBody(), now));
            if (response != null) {
                conversationStore.append(context.getChannelId(),
                    new ConversationMessage(ConversationMessage.Role.ASSISTANT, null, response, now));
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to record analytics for channel {}: {}", context.getChannelId(), e.getMessage());
            return false;
        }
    }
}
