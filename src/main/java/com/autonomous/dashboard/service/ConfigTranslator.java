package com.autonomous.dashboard.service;

import com.autonomous.dashboard.gateway.GatewayJson;
import com.autonomous.dashboard.model.ConfigChange;
import com.autonomous.dashboard.model.ConfigViolation;
import com.autonomous.dashboard.model.FeatureToggles;
import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.model.PersonalityConfig;
import com.autonomous.dashboard.model.PromptOptions;
import com.autonomous.dashboard.model.RateLimitConfig;
import com.autonomous.dashboard.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Component
public class ConfigTranslator {

    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 1000;

    private static final String PART_SEPARATOR = "\n\n";

    private static final Map<String, String> LANGUAGE_NAMES = Map.ofEntries(
        Map.entry("en", "English"),
        Map.entry("en-US", "American English"),
        Map.entry("en-GB", "British English"),
        Map.entry("pt", "Portuguese"),
        Map.entry("pt-BR", "Brazilian Portuguese"),
        Map.entry("pt-PT", "European Portuguese"),
        Map.entry("es", "Spanish"),
        Map.entry("es-ES", "Castilian Spanish"),
        Map.entry("es-MX", "Mexican Spanish"),
        Map.entry("fr", "French"),
        Map.entry("de", "German"),
        Map.entry("it", "Italian"),
        Map.entry("nl", "Dutch"),
        Map.entry("ru", "Russian"),
        Map.entry("zh", "Chinese"),
        Map.entry("zh-CN", "Simplified Chinese"),
        Map.entry("zh-TW", "Traditional Chinese"),
        Map.entry("ja", "Japanese"),
        Map.entry("ko", "Korean"),
        Map.entry("ar", "Arabic"),
        Map.entry("hi", "Hindi"),
        Map.entry("he", "Hebrew"),
        Map.entry("pl", "Polish"),
        Map.entry("tr", "Turkish"),
        Map.entry("th", "Thai"),
        Map.entry("vi", "Vietnamese"),
        Map.entry("id", "Indonesian"),
        Map.entry("ms", "Malay"),
        Map.entry("sv", "Swedish"),
        Map.entry("da", "Danish"),
        Map.entry("no", "Norwegian"),
        Map.entry("fi", "Finnish"),
        Map.entry("cs", "Czech"),
        Map.entry("uk", "Ukrainian"),
        Map.entry("el", "Greek"),
        Map.entry("ro", "Romanian"),
        Map.entry("hu", "Hungarian")
    );

    private final ObjectMapper mapper = GatewayJson.newObjectMapper();

    // ============================================
    // Personality to prompt
    // ============================================

    public String personalityToPrompt(PersonalityConfig personality, PromptOptions options) {
        PromptOptions opts = options != null ? options : PromptOptions.none();
        List<String> parts = new ArrayList<>();

        StringBuilder identity = new StringBuilder("You are a helpful AI assistant");
        if (hasText(opts.getOrganizationName())) {
            identity.append(" for ").append(opts.getOrganizationName());
        }
        if (hasText(opts.getGroupName())) {
            identity.append(" in the group \"").append(opts.getGroupName()).append('"');
        }
        parts.add(identity.append('.').toString());

        if (hasText(opts.getPurpose())) {
            parts.add("Your purpose is: " + opts.getPurpose());
        }

        parts.addAll(personalityDirectives(personality, opts.getLanguage()));

        if (hasText(opts.getAdditionalInstructions())) {
            parts.add(opts.getAdditionalInstructions());
        }
        return String.join(PART_SEPARATOR, parts);
    }

    /**
     * Slider directives followed by tone, language and custom instructions. The language
     * override, when given, wins over the personality's own language.
     */
    public List<String> personalityDirectives(PersonalityConfig personality, String languageOverride) {
        List<String> parts = new ArrayList<>();
        for (PersonalityTrait trait : PersonalityTrait.values()) {
            parts.add(trait.directiveFor(personality));
        }
        if (personality != null && hasText(personality.getTone())) {
            parts.add("Maintain a " + personality.getTone() + " tone throughout your responses.");
        }
        String language = hasText(languageOverride) ? languageOverride
            : personality != null ? personality.getLanguage() : null;
        if (hasText(language)) {
            parts.add("Respond in " + languageName(language) + ".");
        }
        if (personality != null && hasText(personality.getCustomInstructions())) {
            parts.add(personality.getCustomInstructions());
        }
        return parts;
    }

    public String languageName(String code) {
        return LANGUAGE_NAMES.getOrDefault(code, code);
    }

    // ============================================
    // Validation
    // ============================================

    public ValidationResult validateGroupConfig(GroupConfig config) {
        List<ConfigViolation> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        PersonalityConfig personality = config.getPersonality();
        if (personality != null) {
            for (PersonalityTrait trait : PersonalityTrait.values()) {
                Integer value = trait.rawValue(personality);
                if (value != null && (value < 0 || value > 100)) {
                    errors.add(new ConfigViolation("personality." + trait.field(),
                        "Personality " + trait.field() + " must be between 0 and 100"));
                }
            }
        } else {
            warnings.add("No personality configured, default will be used");
        }

        List<String> patterns = config.getMentionPatterns();
        if (patterns != null) {
            for (int i = 0; i < patterns.size(); i++) {
                String pattern = patterns.get(i);
                if (!compiles(pattern)) {
                    errors.add(new ConfigViolation("mentionPatterns[" + i + "]", "Invalid regex pattern: " + pattern));
                }
            }
        }

        Integer historyLimit = config.getHistoryLimit();
        if (historyLimit != null && (historyLimit < 0 || historyLimit > MAX_HISTORY_LIMIT)) {
            errors.add(new ConfigViolation("historyLimit", "History limit must be between 0 and " + MAX_HISTORY_LIMIT));
        }

        RateLimitConfig rateLimit = config.getRateLimit();
        if (rateLimit != null) {
            if (rateLimit.getMaxMessagesPerMinute() != null && rateLimit.getMaxMessagesPerMinute() < 1) {
                errors.add(new ConfigViolation("rateLimit.maxMessagesPerMinute", "Max messages per minute must be at least 1"));
            }
            if (rateLimit.getMaxTokensPerDay() != null && rateLimit.getMaxTokensPerDay() < 100) {
                warnings.add("Max tokens per day is very low, bot may not be able to respond properly");
            }
        }

        if (config.isEnabled() && config.isRequireMention() && (patterns == null || patterns.isEmpty())) {
            warnings.add("Mention required but no mention patterns configured, bot will only respond to native @mentions");
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public ValidationResult requireValid(GroupConfig config) {
        ValidationResult result = validateGroupConfig(config);
        if (!result.isValid()) {
            throw new ConfigValidationException(result.getErrors());
        }
        return result;
    }

    // ============================================
    // Diff
    // ============================================

    public List<ConfigChange> diffConfigs(GroupConfig oldConfig, GroupConfig newConfig) {
        JsonNode oldTree = oldConfig != null ? mapper.valueToTree(oldConfig) : mapper.createObjectNode();
        JsonNode newTree = newConfig != null ? mapper.valueToTree(newConfig) : mapper.createObjectNode();

        Set<String> fields = new LinkedHashSet<>();
        oldTree.fieldNames().forEachRemaining(fields::add);
        newTree.fieldNames().forEachRemaining(fields::add);

        List<ConfigChange> changes = new ArrayList<>();
        for (String field : fields) {
            JsonNode before = oldTree.get(field);
            JsonNode after = newTree.get(field);
            if (!Objects.equals(before, after)) {
                changes.add(new ConfigChange(field, before, after));
            }
        }
        return changes;
    }

    // ============================================
    // Gateway mapping
    // ============================================

    /**
     * The group entry written into the gateway config. Unset and blank values are left out so
     * the gateway keeps inheriting them from the wildcard entry.
     */
    public GroupConfig toGatewayGroupConfig(GroupConfig config) {
        return GroupConfig.builder()
            .requireMention(config.isRequireMention())
            .mentionPatterns(config.getMentionPatterns())
            .enabled(config.isEnabled())
            .historyLimit(config.getHistoryLimit())
            .agentId(hasText(config.getAgentId()) ? config.getAgentId() : null)
            .systemPrompt(hasText(config.getSystemPrompt()) ? config.getSystemPrompt() : null)
            .personality(config.getPersonality())
            .rateLimit(config.getRateLimit())
            .features(config.getFeatures())
            .build();
    }

    /**
     * Gateway routing fields from {@code remote}, dashboard-only fields kept from {@code existing}
     * or defaulted when there is nothing to keep.
     */
    public GroupConfig fromGatewayGroupConfig(GroupConfig remote, GroupConfig existing) {
        GroupConfig defaults = defaultGroupConfig();
        return GroupConfig.builder()
            .requireMention(remote.isRequireMention())
            .mentionPatterns(remote.getMentionPatterns())
            .enabled(remote.isEnabled())
            .historyLimit(remote.getHistoryLimit())
            .personality(firstNonNull(existing != null ? existing.getPersonality() : null,
                remote.getPersonality(), defaults.getPersonality()))
            .systemPrompt(firstNonNull(existing != null ? existing.getSystemPrompt() : null, remote.getSystemPrompt()))
            .agentId(firstNonNull(existing != null ? existing.getAgentId() : null, remote.getAgentId()))
            .rateLimit(firstNonNull(existing != null ? existing.getRateLimit() : null, remote.getRateLimit()))
            .features(firstNonNull(existing != null ? existing.getFeatures() : null,
                remote.getFeatures(), defaults.getFeatures()))
            .build();
    }

    public GroupConfig defaultGroupConfig() {
        return GroupConfig.builder()
            .requireMention(true)
            .enabled(true)
            .historyLimit(DEFAULT_HISTORY_LIMIT)
            .personality(PersonalityConfig.balanced())
            .features(FeatureToggles.builder()
                .imageAnalysis(true)
                .voiceMessages(false)
                .codeExecution(false)
                .webSearch(true)
                .build())
            .build();
    }

    public GroupConfig pendingGroupConfig() {
        return GroupConfig.builder()
            .requireMention(true)
            .enabled(false)
            .historyLimit(DEFAULT_HISTORY_LIMIT)
            .build();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static boolean compiles(String pattern) {
        if (pattern == null) {
            return false;
        }
        try {
            Pattern.compile(pattern);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
