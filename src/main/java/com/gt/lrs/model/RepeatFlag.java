package com.gt.lrs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

// Learner preference for re-queuing the alphabet once every character is mastered
public enum RepeatFlag {
    InQuestion("in question"),
    Ignore("ignore"),
    Repeat("repeat");

    public static final RepeatFlag DEFAULT = InQuestion;

    private final String id;

    RepeatFlag(String id) {
        this.id = id;
    }

    private static final Map<String, RepeatFlag> flagsById = Arrays.stream(RepeatFlag.values()).collect(Collectors.toMap(f -> f.id, f -> f));

    public static RepeatFlag getRepeatFlagById(String id) {
        return id == null ? null : flagsById.get(id.trim().toLowerCase());
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
