package com.gt.lrs.mastery;

import com.gt.lrs.character.CharacterDao;
import com.gt.lrs.model.RepeatFlag;
import com.gt.lrs.model.UserMasteryHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class FullMasteryRepeatPromptPolicyTests {

    private static final long TEST_USER_ID = 11;

    @Mock private CharacterDao characterDao;
    @Mock private CharacterMasteryDao characterMasteryDao;

    private FullMasteryRepeatPromptPolicy repeatPromptPolicy;

    @BeforeEach
    public void setup() {
        repeatPromptPolicy = new FullMasteryRepeatPromptPolicy(characterDao, characterMasteryDao);
    }

    @Test
    public void testFullMastery() {
        when(characterDao.countCharacters()).thenReturn(2);
        when(characterMasteryDao.loadUserHistory(TEST_USER_ID)).thenReturn(List.of(mastered(1), mastered(2)));

        assertTrue(repeatPromptPolicy.shouldAskForRepeat(TEST_USER_ID, RepeatFlag.InQuestion));
    }

    @Test
    public void testPartialMastery() {
        when(characterDao.countCharacters()).thenReturn(2);
        when(characterMasteryDao.loadUserHistory(TEST_USER_ID)).thenReturn(List.of(
                mastered(1),
                new UserMasteryHistory(2, "い", "イ", 1, 1, 1, 1, 1, 0.99)));

        assertFalse(repeatPromptPolicy.shouldAskForRepeat(TEST_USER_ID, RepeatFlag.InQuestion));
    }

    @Test
    public void testMissingCharacters() {
        when(characterDao.countCharacters()).thenReturn(3);
        when(characterMasteryDao.loadUserHistory(TEST_USER_ID)).thenReturn(List.of(mastered(1), mastered(2)));

        assertFalse(repeatPromptPolicy.shouldAskForRepeat(TEST_USER_ID, RepeatFlag.InQuestion));
    }

    @Test
    public void testEmptyCatalog() {
        when(characterDao.countCharacters()).thenReturn(0);
        when(characterMasteryDao.loadUserHistory(TEST_USER_ID)).thenReturn(List.of());

        assertFalse(repeatPromptPolicy.shouldAskForRepeat(TEST_USER_ID, RepeatFlag.InQuestion));
    }

    @Test
    public void testFlagAlreadyDecided() {
        assertFalse(repeatPromptPolicy.shouldAskForRepeat(TEST_USER_ID, RepeatFlag.Ignore));
        assertFalse(repeatPromptPolicy.shouldAskForRepeat(TEST_USER_ID, RepeatFlag.Repeat));

        verifyNoInteractions(characterDao);
        verifyNoInteractions(characterMasteryDao);
    }

    private static UserMasteryHistory mastered(int characterId) {
        return new UserMasteryHistory(characterId, "g" + characterId, "G" + characterId, 1, 1, 1, 1, 1, 1);
    }
}
