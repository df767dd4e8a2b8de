package com.gt.lrs.character;

import com.gt.lrs.model.KanaCharacter;
import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CharacterDao {

    // All characters that have a glyph in the given script, ordered by id
    List<KanaCharacter> loadCharacters(Script script);

    // Characters belonging to the consonant or vowel group, ordered by id
    List<KanaCharacter> loadCharactersByGroup(Script script, String group);

    List<KanaCharacter> loadCharacters(Collection<Integer> characterIds);

    Optional<KanaCharacter> loadCharacter(int characterId);

    // Characters the user has no mastery record for, in random order
    List<Integer> loadUntestedCharacterIds(long userId, Script script, boolean audioRequired, int limit);

    // Characters the user has a mastery record for, lowest score for the script and skill first, ties in random order
    List<Integer> loadWeakestCharacterIds(long userId, Script script, Skill skill, boolean audioRequired, int limit);

    // Distinct glyphs of the script that distractors can be drawn from
    List<String> loadGlyphPool(Script script, boolean audioRequired);

    int countCharacters();
}
