package com.gt.lrs.word.impl;

import com.gt.lrs.model.UserLocale;
import com.gt.lrs.model.WordResponse;
import com.gt.lrs.word.WordDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class WordDaoPG implements WordDao {

    private static final String LOAD_WORDS_SQL =
            "SELECT id, word, phonetic_clues, %s AS translation, example, %s AS example_translation, " +
                    "easy_period, normal_period, hard_period, extra_hard_period " +
            "FROM words " +
            "WHERE id IN (:wordIds)";

    private static final String LOAD_UNREVIEWED_WORD_IDS_SQL_SELECT =
            "SELECT w.id " +
            "FROM words w " +
            "LEFT JOIN dictionary_history h ON h.word_id = w.id AND h.user_id = :userId " +
            "WHERE h.word_id IS NULL ";
    private static final String LOAD_RANDOM_WORD_IDS_SQL_SELECT =
            "SELECT w.id " +
            "FROM words w " +
            "WHERE TRUE ";
    private static final String EXCLUDE_WORD_IDS_SQL =
            "AND w.id NOT IN (:excludeIds) ";
    private static final String RANDOM_ORDER_AND_LIMIT_SQL =
            "ORDER BY random() LIMIT :limit";

    private static final String COUNT_EXISTING_WORDS_SQL =
            "SELECT COUNT(*) FROM words WHERE id IN (:wordIds)";

    private final NamedParameterJdbcTemplate template;

    public WordDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<WordResponse> loadWords(Collection<Integer> wordIds, UserLocale locale) {
        if (wordIds.isEmpty()) {
            return List.of();
        }

        String sql = String.format(LOAD_WORDS_SQL, getTranslationColumn(locale), getExampleTranslationColumn(locale));
        return template.query(sql, Map.of("wordIds", wordIds), WordDaoPG::getWordResponseFromResultSet);
    }

    @Override
    public List<Integer> loadUnreviewedWordIds(long userId, Collection<Integer> excludeIds, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("userId", userId);

        return loadRandomWordIds(LOAD_UNREVIEWED_WORD_IDS_SQL_SELECT, params, excludeIds, limit);
    }

    @Override
    public List<Integer> loadRandomWordIds(Collection<Integer> excludeIds, int limit) {
        return loadRandomWordIds(LOAD_RANDOM_WORD_IDS_SQL_SELECT, new MapSqlParameterSource(), excludeIds, limit);
    }

    private List<Integer> loadRandomWordIds(String selectSql, MapSqlParameterSource params, Collection<Integer> excludeIds, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        StringBuilder sb = new StringBuilder(selectSql);
        if (!excludeIds.isEmpty()) {
            sb.append(EXCLUDE_WORD_IDS_SQL);
            params.addValue("excludeIds", excludeIds);
        }
        sb.append(RANDOM_ORDER_AND_LIMIT_SQL);
        params.addValue("limit", limit);

        return template.queryForList(sb.toString(), params, Integer.class);
    }

    @Override
    public int countExistingWords(Collection<Integer> wordIds) {
        if (wordIds.isEmpty()) {
            return 0;
        }

        Integer count = template.queryForObject(COUNT_EXISTING_WORDS_SQL, Map.of("wordIds", wordIds), Integer.class);
        return count == null ? 0 : count;
    }

    private static String getTranslationColumn(UserLocale locale) {
        return switch (locale) {
            case En -> "english_translation";
            case Ru -> "russian_translation";
            case De -> "german_translation";
        };
    }

    private static String getExampleTranslationColumn(UserLocale locale) {
        return switch (locale) {
            case En -> "example_english_translation";
            case Ru -> "example_russian_translation";
            case De -> "example_german_translation";
        };
    }

    private static WordResponse getWordResponseFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new WordResponse(
                rs.getInt("id"),
                rs.getString("word"),
                rs.getString("phonetic_clues"),
                rs.getString("translation"),
                rs.getString("example"),
                rs.getString("example_translation"),
                rs.getInt("easy_period"),
                rs.getInt("normal_period"),
                rs.getInt("hard_period"),
                rs.getInt("extra_hard_period"));
    }
}
