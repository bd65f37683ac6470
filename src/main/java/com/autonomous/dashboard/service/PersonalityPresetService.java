package com.autonomous.dashboard.service;

import com.autonomous.dashboard.model.PersonalityConfig;
import com.autonomous.dashboard.model.PersonalityPreset;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class PersonalityPresetService {

    @Value("${dashboard.presets.path:classpath:personality-presets.yaml}")
    private String presetsPath;

    @Value("${dashboard.default-preset:}")
    private String defaultPresetId;

    private final ResourceLoader resourceLoader = new DefaultResourceLoader();
    private final ObjectMapper yamlMapper;

    private volatile Map<String, PersonalityPreset> presets = Map.of();

    public PersonalityPresetService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setPresetsPath(String path) {
        this.presetsPath = path;
    }

    public void setDefaultPresetId(String presetId) {
        this.defaultPresetId = presetId;
    }

    @PostConstruct
    public void loadPresets() {
        Resource resource = resourceLoader.getResource(presetsPath);
        if (!resource.exists()) {
            log.warn("Personality presets not found: {}", presetsPath);
            presets = Map.of();
            return;
        }

        Map<String, PersonalityPreset> loaded = new LinkedHashMap<>();
        try (InputStream in = resource.getInputStream()) {
            List<PersonalityPreset> list = yamlMapper.readValue(in, new TypeReference<List<PersonalityPreset>>() {});
            for (PersonalityPreset preset : list) {
                if (preset.getId() == null || preset.getPersonality() == null) {
                    log.warn("Skipping preset without id or personality in {}", presetsPath);
                    continue;
                }
                loaded.put(preset.getId(), preset);
            }
        } catch (IOException e) {
            log.error("Failed to load personality presets from {}: {}", presetsPath, e.getMessage());
        }
        presets = loaded;
        log.info("Loaded {} personality presets", loaded.size());
    }

    public Optional<PersonalityPreset> getPreset(String id) {
        return Optional.ofNullable(presets.get(id));
    }

    public List<PersonalityPreset> getAllPresets() {
        return new ArrayList<>(presets.values());
    }

    public PersonalityConfig defaultPersonality() {
        if (defaultPresetId != null && !defaultPresetId.isBlank()) {
            Optional<PersonalityPreset> preset = getPreset(defaultPresetId);
            if (preset.isPresent()) {
                return preset.get().getPersonality();
            }
            log.warn("Default preset {} not found, using balanced personality", defaultPresetId);
        }
        return PersonalityConfig.balanced();
    }
}
