package com.gt.lrs.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CharacterMasteryTests {

    @Test
    public void testClamp() {
        CharacterMastery mastery = new CharacterMastery(1, 2, -0.5, 1.5, Double.NaN, 0.25, 0, 1);

        assertEquals(0.0, mastery.hiraganaReading());
        assertEquals(1.0, mastery.hiraganaWriting());
        assertEquals(0.0, mastery.hiraganaListening());
        assertEquals(0.25, mastery.katakanaReading());
    }

    @Test
    public void testWithScore() {
        CharacterMastery mastery = new CharacterMastery(1, 2, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6);

        for (Script script : Script.values()) {
            for (Skill skill : Skill.values()) {
                CharacterMastery updated = mastery.withScore(script, skill, 0.95);

                assertEquals(0.95, updated.getScore(script, skill));
                for (Script otherScript : Script.values()) {
                    for (Skill otherSkill : Skill.values()) {
                        if (otherScript != script || otherSkill != skill) {
                            assertEquals(mastery.getScore(otherScript, otherSkill), updated.getScore(otherScript, otherSkill));
                        }
                    }
                }
            }
        }
    }

    @Test
    public void testEmpty() {
        CharacterMastery mastery = CharacterMastery.empty(4, 8);

        assertEquals(4, mastery.userId());
        assertEquals(8, mastery.characterId());
        assertEquals(new CharacterMastery(4, 8, 0, 0, 0, 0, 0, 0), mastery);
    }
}
