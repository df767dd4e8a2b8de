package com.gt.lrs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

public enum Script {
    Hiragana("hiragana"),
    Katakana("katakana");

    private final String id;

    Script(String id) {
        this.id = id;
    }

    private static final Map<String, Script> scriptsById = Arrays.stream(Script.values()).collect(Collectors.toMap(s -> s.id, s -> s));

    // Case-insensitive. Returns null for anything that is not a known script.
    public static Script getScriptById(String id) {
        return id == null ? null : scriptsById.get(id.trim().toLowerCase());
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
