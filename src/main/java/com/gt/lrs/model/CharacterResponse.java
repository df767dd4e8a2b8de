package com.gt.lrs.model;

public record CharacterResponse(int id, String consonant, String vowel, String character, String reading) {

    public static CharacterResponse fromCharacter(KanaCharacter character, Script script, UserLocale locale) {
        return new CharacterResponse(
                character.id(),
                character.consonant(),
                character.vowel(),
                character.getGlyph(script),
                character.getReading(locale));
    }
}
