package com.gt.lrs.model;

import java.util.List;

public record ListeningTestItem(int id, String audio, String correctChar, List<String> wrongOptions) implements CharacterTestItem {

    public ListeningTestItem {
        wrongOptions = List.copyOf(wrongOptions);
    }
}
