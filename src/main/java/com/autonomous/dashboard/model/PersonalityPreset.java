package com.autonomous.dashboard.model;

import lombok.Data;

@Data
public class PersonalityPreset {
    private String id;
    private String name;
    private String description;
    private String icon;
    private PersonalityConfig personality;
}
