package com.gt.lrs.model;

import java.util.List;

public record ReadingTestItem(int id, String reading, String correctChar, List<String> wrongOptions) implements CharacterTestItem {

    public ReadingTestItem {
        wrongOptions = List.copyOf(wrongOptions);
    }
}
