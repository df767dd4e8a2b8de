package com.gt.lrs.mastery.impl;

import com.gt.lrs.character.impl.CharacterDaoPG;
import com.gt.lrs.exception.DaoException;
import com.gt.lrs.exception.ValidationException;
import com.gt.lrs.mastery.CharacterMasteryDao;
import com.gt.lrs.model.CharacterMastery;
import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;
import com.gt.lrs.model.UserMasteryHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class CharacterMasteryDaoPG implements CharacterMasteryDao {

    private static final Logger log = LoggerFactory.getLogger(CharacterMasteryDaoPG.class);

    private static final String LOAD_MASTERY_SQL =
            "SELECT user_id, character_id, hiragana_reading, hiragana_writing, hiragana_listening, " +
                    "katakana_reading, katakana_writing, katakana_listening " +
            "FROM character_mastery " +
            "WHERE user_id = :userId AND character_id IN (:characterIds)";

    private static final String LOAD_USER_HISTORY_SQL =
            "SELECT m.character_id, c.hiragana, c.katakana, m.hiragana_reading, m.hiragana_writing, m.hiragana_listening, " +
                    "m.katakana_reading, m.katakana_writing, m.katakana_listening " +
            "FROM character_mastery m " +
            "JOIN characters c ON c.id = m.character_id " +
            "WHERE m.user_id = :userId " +
            "ORDER BY c.id ASC";

    private static final String SCORE_TOKEN = "$score$";

    // Only the tested column is written, new rows take the column defaults for the other five
    private static final String UPSERT_MASTERY_SQL =
            "INSERT INTO character_mastery (user_id, character_id, " + SCORE_TOKEN + ") " +
                    "VALUES (:userId, :characterId, :score) " +
            "ON CONFLICT (user_id, character_id) DO UPDATE " +
                    "SET " + SCORE_TOKEN + " = EXCLUDED." + SCORE_TOKEN;

    private static final String DECAY_SCORES_SQL =
            "UPDATE character_mastery " +
            "SET hiragana_reading = GREATEST(0, hiragana_reading - :step), " +
                "hiragana_writing = GREATEST(0, hiragana_writing - :step), " +
                "hiragana_listening = GREATEST(0, hiragana_listening - :step), " +
                "katakana_reading = GREATEST(0, katakana_reading - :step), " +
                "katakana_writing = GREATEST(0, katakana_writing - :step), " +
                "katakana_listening = GREATEST(0, katakana_listening - :step) " +
            "WHERE user_id = :userId";

    private final NamedParameterJdbcTemplate template;

    public CharacterMasteryDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<CharacterMastery> loadMastery(long userId, Collection<Integer> characterIds) {
        if (characterIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_MASTERY_SQL,
                Map.of("userId", userId, "characterIds", characterIds),
                CharacterMasteryDaoPG::getCharacterMasteryFromResultSet);
    }

    @Override
    public List<UserMasteryHistory> loadUserHistory(long userId) {
        return template.query(LOAD_USER_HISTORY_SQL,
                Map.of("userId", userId),
                CharacterMasteryDaoPG::getUserMasteryHistoryFromResultSet);
    }

    @Override
    @Transactional
    public int upsertMastery(Script script, Skill skill, List<CharacterMastery> records) {
        if (records == null || records.isEmpty()) {
            throw new ValidationException("No mastery records to save");
        }

        SqlParameterSource[] paramsArray = new SqlParameterSource[records.size()];
        for (int index = 0; index < records.size(); index++) {
            CharacterMastery record = records.get(index);
            paramsArray[index] = new MapSqlParameterSource(Map.of(
                    "userId", record.userId(),
                    "characterId", record.characterId(),
                    "score", record.getScore(script, skill)));
        }

        try {
            template.batchUpdate(UPSERT_MASTERY_SQL.replace(SCORE_TOKEN, CharacterDaoPG.getScoreColumn(script, skill)), paramsArray);
            return paramsArray.length;
        } catch (DataAccessException ex) {
            log.error("Failed to save {} mastery records", records.size(), ex);
            throw new DaoException("Failed to save mastery records", ex);
        }
    }

    @Override
    public int decayScores(long userId, double step) {
        try {
            return template.update(DECAY_SCORES_SQL, Map.of("userId", userId, "step", step));
        } catch (DataAccessException ex) {
            log.error("Failed to decay scores for user {}", userId, ex);
            throw new DaoException("Failed to decay mastery scores", ex);
        }
    }

    private static CharacterMastery getCharacterMasteryFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new CharacterMastery(
                rs.getLong("user_id"),
                rs.getInt("character_id"),
                rs.getDouble("hiragana_reading"),
                rs.getDouble("hiragana_writing"),
                rs.getDouble("hiragana_listening"),
                rs.getDouble("katakana_reading"),
                rs.getDouble("katakana_writing"),
                rs.getDouble("katakana_listening"));
    }

    private static UserMasteryHistory getUserMasteryHistoryFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new UserMasteryHistory(
                rs.getInt("character_id"),
                rs.getString("hiragana"),
                rs.getString("katakana"),
                rs.getDouble("hiragana_reading"),
                rs.getDouble("hiragana_writing"),
                rs.getDouble("hiragana_listening"),
                rs.getDouble("katakana_reading"),
                rs.getDouble("katakana_writing"),
                rs.getDouble("katakana_listening"));
    }
}
