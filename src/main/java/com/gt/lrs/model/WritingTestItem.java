package com.gt.lrs.model;

// Open form question: the glyph is shown and its reading has to be typed
public record WritingTestItem(int id, String correctChar, String correctReading) implements CharacterTestItem { }
