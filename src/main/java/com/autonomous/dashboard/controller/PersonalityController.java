package com.autonomous.dashboard.controller;

import com.autonomous.dashboard.model.GroupConfig;
import com.autonomous.dashboard.model.PersonalityConfig;
import com.autonomous.dashboard.model.PromptOptions;
import com.autonomous.dashboard.service.ConfigTranslator;
import com.autonomous.dashboard.service.PersonalityPresetService;
import lombok.Data;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/clawdbot/personality")
public class PersonalityController {

    @Autowired
    private ConfigTranslator configTranslator;

    @Autowired
    private PersonalityPresetService presetService;

    @PostMapping("/preview")
    public ResponseEntity<?> preview(@RequestBody PreviewRequest request) {
        PersonalityConfig personality = request.getPersonality() != null
            ? request.getPersonality()
            : presetService.defaultPersonality();
        configTranslator.requireValid(GroupConfig.builder().personality(personality).build());

        String prompt = configTranslator.personalityToPrompt(personality, PromptOptions.builder()
            .organizationName(request.getOrganizationName())
            .groupName(request.getGroupName())
            .purpose(request.getPurpose())
            .language(request.getLanguage())
            .additionalInstructions(request.getAdditionalInstructions())
            .build());
        return ResponseEntity.ok(Map.of("success", true, "data", Map.of("prompt", prompt)));
    }

    @GetMapping("/presets")
    public ResponseEntity<?> presets() {
        return ResponseEntity.ok(Map.of("success", true, "data", presetService.getAllPresets()));
    }

    @Data
    public static class PreviewRequest {
        private PersonalityConfig personality;
        private String organizationName;
        private String groupName;
        private String purpose;
        private String language;
        private String additionalInstructions;
    }
}
