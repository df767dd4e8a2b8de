package com.gt.lrs.model;

public record KanaCharacter(int id,
                            String consonant,
                            String vowel,
                            String hiragana,
                            String katakana,
                            String englishReading,
                            String russianReading,
                            String audio) {

    public String getGlyph(Script script) {
        return script == Script.Hiragana ? hiragana : katakana;
    }

    public String getReading(UserLocale locale) {
        return locale.getCharacterLocale() == UserLocale.Ru ? russianReading : englishReading;
    }
}
