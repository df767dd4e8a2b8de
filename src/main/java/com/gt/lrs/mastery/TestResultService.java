package com.gt.lrs.mastery;

import com.gt.lrs.exception.ValidationException;
import com.gt.lrs.model.CharacterMastery;
import com.gt.lrs.model.RepeatFlag;
import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;
import com.gt.lrs.model.SubmitTestResultsResponse;
import com.gt.lrs.model.TestResult;
import com.gt.lrs.model.UserMasteryHistory;
import com.gt.lrs.util.ParamParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class TestResultService {

    private static final Logger log = LoggerFactory.getLogger(TestResultService.class);

    private final CharacterMasteryDao characterMasteryDao;
    private final ScoreUpdatePolicy scoreUpdatePolicy;
    private final RepeatPromptPolicy repeatPromptPolicy;
    private final double decayStep;

    @Autowired
    public TestResultService(CharacterMasteryDao characterMasteryDao,
                             ScoreUpdatePolicy scoreUpdatePolicy,
                             RepeatPromptPolicy repeatPromptPolicy,
                             @Value("${lrs.mastery.decayStep:0.01}") double decayStep) {
        this.characterMasteryDao = characterMasteryDao;
        this.scoreUpdatePolicy = scoreUpdatePolicy;
        this.repeatPromptPolicy = repeatPromptPolicy;

        this.decayStep = decayStep;
    }

    /**
     * Applies test answers to the score of the tested script and skill. The other five scores of each character are
     * left as they were, and characters seen for the first time start from zero. All records are written together.
     */
    public SubmitTestResultsResponse submitResults(long userId, String scriptId, String skillId, List<TestResult> results, String repeatFlagId) {
        Script script = ParamParser.parseScript(scriptId);
        Skill skill = ParamParser.parseSkill(skillId);
        RepeatFlag repeatFlag = ParamParser.parseRepeatFlag(repeatFlagId);
        validateResults(results);

        Set<Integer> characterIds = new LinkedHashSet<>();
        for (TestResult result : results) {
            characterIds.add(result.characterId());
        }

        Map<Integer, CharacterMastery> masteryByCharacterId = new LinkedHashMap<>();
        for (CharacterMastery existing : characterMasteryDao.loadMastery(userId, characterIds)) {
            masteryByCharacterId.put(existing.characterId(), existing);
        }

        for (TestResult result : results) {
            CharacterMastery mastery = masteryByCharacterId.getOrDefault(result.characterId(), CharacterMastery.empty(userId, result.characterId()));
            double updatedScore = scoreUpdatePolicy.updateScore(mastery.getScore(script, skill), result.passed());

            masteryByCharacterId.put(result.characterId(), mastery.withScore(script, skill, updatedScore));
        }

        List<CharacterMastery> toSave = new ArrayList<>(characterIds.size());
        for (Integer characterId : characterIds) {
            toSave.add(masteryByCharacterId.get(characterId));
        }

        int savedCnt = characterMasteryDao.upsertMastery(script, skill, toSave);
        log.info("Saved {} {} {} results for user {}", savedCnt, script.getId(), skill.getId(), userId);

        return new SubmitTestResultsResponse(repeatPromptPolicy.shouldAskForRepeat(userId, repeatFlag));
    }

    public List<UserMasteryHistory> getUserHistory(long userId) {
        return characterMasteryDao.loadUserHistory(userId);
    }

    // Maintenance operation meant for a periodic external caller. A user without records is not an error.
    public int dropMarks(long userId) {
        if (userId <= 0) {
            throw new ValidationException("Invalid user id: " + userId);
        }

        int decayedCnt = characterMasteryDao.decayScores(userId, decayStep);
        log.info("Lowered marks by {} on {} characters for user {}", decayStep, decayedCnt, userId);

        return decayedCnt;
    }

    private static void validateResults(List<TestResult> results) {
        if (results == null || results.isEmpty()) {
            throw new ValidationException("Results list cannot be empty");
        }

        for (TestResult result : results) {
            if (result == null || result.characterId() == null || result.passed() == null) {
                throw new ValidationException("Every result must have a character id and a passed flag");
            }
            if (result.characterId() <= 0) {
                throw new ValidationException("Invalid character id: " + result.characterId());
            }
        }
    }
}
