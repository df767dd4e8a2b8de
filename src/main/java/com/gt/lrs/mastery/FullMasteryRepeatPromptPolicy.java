package com.gt.lrs.mastery;

import com.gt.lrs.character.CharacterDao;
import com.gt.lrs.model.RepeatFlag;
import com.gt.lrs.model.UserMasteryHistory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks only while the learner has not made up their mind ({@link RepeatFlag#InQuestion}) and only once every
 * character in the catalog has a full score for both scripts and all three skills.
 */
@Component
public class FullMasteryRepeatPromptPolicy implements RepeatPromptPolicy {

    static final int SCORES_PER_CHARACTER = 6;
    static final double TOLERANCE = 0.001;

    private final CharacterDao characterDao;
    private final CharacterMasteryDao characterMasteryDao;

    @Autowired
    public FullMasteryRepeatPromptPolicy(CharacterDao characterDao, CharacterMasteryDao characterMasteryDao) {
        this.characterDao = characterDao;
        this.characterMasteryDao = characterMasteryDao;
    }

    @Override
    public boolean shouldAskForRepeat(long userId, RepeatFlag repeatFlag) {
        if (repeatFlag != RepeatFlag.InQuestion) {
            return false;
        }

        int characterCnt = characterDao.countCharacters();
        if (characterCnt == 0) {
            return false;
        }

        List<UserMasteryHistory> history = characterMasteryDao.loadUserHistory(userId);
        double totalScore = history.stream().mapToDouble(UserMasteryHistory::getTotalScore).sum();
        double expectedMax = characterCnt * SCORES_PER_CHARACTER;

        return Math.abs(totalScore - expectedMax) <= TOLERANCE;
    }
}
