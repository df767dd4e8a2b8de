package com.gt.lrs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

public enum Skill {
    Reading("reading", true),
    Writing("writing", false),
    Listening("listening", true);

    private final String id;
    private final boolean multipleChoice;

    Skill(String id, boolean multipleChoice) {
        this.id = id;
        this.multipleChoice = multipleChoice;
    }

    private static final Map<String, Skill> skillsById = Arrays.stream(Skill.values()).collect(Collectors.toMap(s -> s.id, s -> s));

    public static Skill getSkillById(String id) {
        return id == null ? null : skillsById.get(id.trim().toLowerCase());
    }

    @JsonValue
    public String getId() {
        return id;
    }

    // Multiple choice tests present the correct glyph alongside distractors
    public boolean isMultipleChoice() {
        return multipleChoice;
    }
}
