package com.gt.lrs.model;

// A word with the translations for a single locale already resolved. Periods are day counts.
public record WordResponse(int id,
                           String word,
                           String phoneticClues,
                           String translation,
                           String example,
                           String exampleTranslation,
                           int easyPeriod,
                           int normalPeriod,
                           int hardPeriod,
                           int extraHardPeriod) { }
