package com.gt.lrs.mastery;

import com.gt.lrs.model.CharacterMastery;
import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;
import com.gt.lrs.model.UserMasteryHistory;

import java.util.Collection;
import java.util.List;

public interface CharacterMasteryDao {

    // Zero or one record per requested character. Characters never tested have no record.
    List<CharacterMastery> loadMastery(long userId, Collection<Integer> characterIds);

    // Every character the user has a record for, ordered by character id
    List<UserMasteryHistory> loadUserHistory(long userId);

    // Writes the (script, skill) score of every record in one transaction. The other scores of existing records are left untouched.
    int upsertMastery(Script script, Skill skill, List<CharacterMastery> records);

    // Lowers every score of the user by step, never below 0. Returns the number of records touched.
    int decayScores(long userId, double step);
}
