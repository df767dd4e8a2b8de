package com.gt.lrs.dictionary.impl;

import com.gt.lrs.dictionary.DictionaryHistoryDao;
import com.gt.lrs.exception.DaoException;
import com.gt.lrs.exception.ValidationException;
import com.gt.lrs.model.WordResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public class DictionaryHistoryDaoPG implements DictionaryHistoryDao {

    private static final Logger log = LoggerFactory.getLogger(DictionaryHistoryDaoPG.class);

    private static final String LOAD_DUE_WORD_IDS_SQL =
            "SELECT word_id " +
            "FROM dictionary_history " +
            "WHERE user_id = :userId AND next_appearance <= :today " +
            "ORDER BY next_appearance ASC " +
            "LIMIT :limit";

    private static final String UPSERT_RESULT_SQL =
            "INSERT INTO dictionary_history (user_id, word_id, next_appearance) " +
            "VALUES (:userId, :wordId, :nextAppearance) " +
            "ON CONFLICT (user_id, word_id) DO UPDATE " +
                    "SET next_appearance = EXCLUDED.next_appearance";

    private final NamedParameterJdbcTemplate template;

    public DictionaryHistoryDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<Integer> loadDueWordIds(long userId, LocalDate today, int limit) {
        return template.queryForList(LOAD_DUE_WORD_IDS_SQL,
                Map.of("userId", userId,
                       "today", Date.valueOf(today),
                       "limit", limit),
                Integer.class);
    }

    @Override
    @Transactional
    public int upsertResults(long userId, List<WordResult> results, LocalDate today) {
        if (results == null || results.isEmpty()) {
            throw new ValidationException("No word results to save");
        }

        SqlParameterSource[] paramsArray = new SqlParameterSource[results.size()];
        for (int index = 0; index < results.size(); index++) {
            WordResult result = results.get(index);
            paramsArray[index] = new MapSqlParameterSource(Map.of(
                    "userId", userId,
                    "wordId", result.wordId(),
                    "nextAppearance", Date.valueOf(today.plusDays(result.period()))));
        }

        try {
            template.batchUpdate(UPSERT_RESULT_SQL, paramsArray);
            return paramsArray.length;
        } catch (DataAccessException ex) {
            log.error("Failed to save {} word results for user {}", results.size(), userId, ex);
            throw new DaoException("Failed to save word results", ex);
        }
    }
}
