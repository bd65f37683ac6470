package com.autonomous.dashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PersonalityConfig {
    private Integer formality;     // casual <-> formal
    private Integer verbosity;     // concise <-> verbose
    private Integer creativity;    // conservative <-> creative
    private Integer empathy;       // neutral <-> empathetic
    private Integer humor;         // serious <-> playful

    private String tone;
    private String language;
    private String customInstructions;

    public static PersonalityConfig balanced() {
        return PersonalityConfig.builder()
            .formality(50)
            .verbosity(50)
            .creativity(50)
            .empathy(50)
            .humor(50)
            .build();
    }
}
