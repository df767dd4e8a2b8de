package com.gt.lrs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Interface language of the learner. Vocabulary carries its own translation for each locale, while characters only
 * have English and Russian readings, so {@link #getCharacterLocale()} folds German onto English.
 */
public enum UserLocale {
    En("en"),
    Ru("ru"),
    De("de");

    private final String id;

    UserLocale(String id) {
        this.id = id;
    }

    private static final Map<String, UserLocale> localesById = Arrays.stream(UserLocale.values()).collect(Collectors.toMap(l -> l.id, l -> l));

    public static UserLocale getLocaleById(String id) {
        return id == null ? null : localesById.get(id.trim().toLowerCase());
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public UserLocale getCharacterLocale() {
        return this == De ? En : this;
    }
}
