package com.autonomous.dashboard.service;

import com.autonomous.dashboard.model.PersonalityConfig;

import java.util.List;
import java.util.function.Function;

// Bands: [0,20) [20,40) [40,60) [60,80) [80,100]
public enum PersonalityTrait {

    FORMALITY("formality", PersonalityConfig::getFormality, List.of(
        "Use a very casual, relaxed communication style. Feel free to use slang, abbreviations, and informal expressions. Be like a friend chatting.",
        "Use a casual, friendly communication style. Keep things light and approachable while still being clear.",
        "Use a balanced communication style, neither too formal nor too casual. Be professional but approachable.",
        "Use a professional, polished communication style. Maintain a level of formality appropriate for business settings.",
        "Use a highly formal, professional communication style. Be precise, courteous, and maintain proper etiquette at all times.")),

    VERBOSITY("verbosity", PersonalityConfig::getVerbosity, List.of(
        "Be extremely concise. Use the minimum words necessary to convey the message. Short sentences, bullet points when appropriate.",
        "Keep responses brief and to the point. Include essential information only, avoiding unnecessary elaboration.",
        "Provide balanced responses with enough detail to be helpful without being overwhelming.",
        "Provide thorough responses with detailed explanations. Include context and examples when helpful.",
        "Provide comprehensive, detailed responses. Elaborate on topics, include examples, context, and explore related aspects thoroughly.")),

    CREATIVITY("creativity", PersonalityConfig::getCreativity, List.of(
        "Stick strictly to facts and established information. Avoid speculation or creative interpretations. Be conservative and precise.",
        "Focus primarily on factual, well-established information. Only suggest alternatives when directly relevant.",
        "Balance factual information with thoughtful suggestions. Feel free to offer creative solutions when appropriate.",
        "Be creative and exploratory in your responses. Suggest novel approaches and think outside the box.",
        "Be highly creative and innovative. Embrace unconventional thinking, propose novel ideas, and explore imaginative possibilities.")),

    EMPATHY("empathy", PersonalityConfig::getEmpathy, List.of(
        "Focus purely on information and solutions. Keep responses objective and task-focused.",
        "Be polite and respectful but focus primarily on providing information and solutions.",
        "Show appropriate empathy and understanding. Acknowledge feelings when relevant while maintaining focus on helping.",
        "Be warm and empathetic. Show genuine understanding of feelings and concerns. Make people feel heard and supported.",
        "Be deeply empathetic and supportive. Prioritize emotional understanding and validation. Create a warm, caring atmosphere in every interaction.")),

    HUMOR("humor", PersonalityConfig::getHumor, List.of(
        "Maintain a serious, professional demeanor. Avoid humor or playfulness entirely.",
        "Keep a mostly serious tone. Occasional light moments are fine but keep them subtle.",
        "Feel free to use appropriate humor when it fits naturally. Balance seriousness with lightheartedness.",
        "Be playful and use humor liberally. Make interactions enjoyable and engaging with wit and levity.",
        "Be fun and playful! Use humor, wordplay, and wit freely. Make every interaction enjoyable and entertaining."));

    public static final int NEUTRAL = 50;

    private final String field;
    private final Function<PersonalityConfig, Integer> accessor;
    private final List<String> directives;

    PersonalityTrait(String field, Function<PersonalityConfig, Integer> accessor, List<String> directives) {
        this.field = field;
        this.accessor = accessor;
        this.directives = directives;
    }

    public String field() {
        return field;
    }

    public Integer rawValue(PersonalityConfig personality) {
        return personality == null ? null : accessor.apply(personality);
    }

    public int valueOf(PersonalityConfig personality) {
        Integer value = rawValue(personality);
        return value != null ? value : NEUTRAL;
    }

    public String directiveFor(PersonalityConfig personality) {
        return directiveFor(valueOf(personality));
    }

    public String directiveFor(int value) {
        return directives.get(band(value));
    }

    static int band(int value) {
        if (value < 20) return 0;
        if (value < 40) return 1;
        if (value < 60) return 2;
        if (value < 80) return 3;
        return 4;
    }
}
