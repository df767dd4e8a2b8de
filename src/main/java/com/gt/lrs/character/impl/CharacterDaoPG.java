package com.gt.lrs.character.impl;

import com.gt.lrs.character.CharacterDao;
import com.gt.lrs.model.KanaCharacter;
import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class CharacterDaoPG implements CharacterDao {

    private static final String GLYPH_TOKEN = "$glyph$";
    private static final String SCORE_TOKEN = "$score$";

    private static final String CHARACTER_COLUMNS =
            "c.id, c.consonant, c.vowel, c.hiragana, c.katakana, c.english_reading, c.russian_reading, c.audio ";

    private static final String GLYPH_PRESENT_SQL =
            "c." + GLYPH_TOKEN + " IS NOT NULL AND c." + GLYPH_TOKEN + " != '' ";
    private static final String AUDIO_PRESENT_SQL =
            "AND c.audio IS NOT NULL AND c.audio != '' ";

    private static final String LOAD_SCRIPT_CHARACTERS_SQL =
            "SELECT " + CHARACTER_COLUMNS +
            "FROM characters c " +
            "WHERE " + GLYPH_PRESENT_SQL +
            "ORDER BY c.id";

    private static final String LOAD_CHARACTERS_BY_GROUP_SQL =
            "SELECT " + CHARACTER_COLUMNS +
            "FROM characters c " +
            "WHERE " + GLYPH_PRESENT_SQL + "AND (c.consonant = :group OR c.vowel = :group) " +
            "ORDER BY c.id";

    private static final String LOAD_CHARACTERS_BY_ID_SQL =
            "SELECT " + CHARACTER_COLUMNS +
            "FROM characters c " +
            "WHERE c.id IN (:characterIds)";

    private static final String LOAD_UNTESTED_CHARACTER_IDS_SQL_SELECT =
            "SELECT c.id " +
            "FROM characters c " +
            "LEFT JOIN character_mastery m ON m.character_id = c.id AND m.user_id = :userId " +
            "WHERE m.character_id IS NULL AND " + GLYPH_PRESENT_SQL;
    private static final String LOAD_UNTESTED_CHARACTER_IDS_SQL_ORDER_AND_LIMIT =
            "ORDER BY random() LIMIT :limit";

    private static final String LOAD_WEAKEST_CHARACTER_IDS_SQL_SELECT =
            "SELECT c.id " +
            "FROM characters c " +
            "JOIN character_mastery m ON m.character_id = c.id AND m.user_id = :userId " +
            "WHERE " + GLYPH_PRESENT_SQL;
    private static final String LOAD_WEAKEST_CHARACTER_IDS_SQL_ORDER_AND_LIMIT =
            "ORDER BY m." + SCORE_TOKEN + " ASC, random() LIMIT :limit";

    private static final String LOAD_GLYPH_POOL_SQL_SELECT =
            "SELECT DISTINCT c." + GLYPH_TOKEN + " " +
            "FROM characters c " +
            "WHERE " + GLYPH_PRESENT_SQL;

    private static final String COUNT_CHARACTERS_SQL =
            "SELECT COUNT(*) FROM characters";

    private final NamedParameterJdbcTemplate template;

    public CharacterDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<KanaCharacter> loadCharacters(Script script) {
        return template.query(withGlyph(LOAD_SCRIPT_CHARACTERS_SQL, script), CharacterDaoPG::getCharacterFromResultSet);
    }

    @Override
    public List<KanaCharacter> loadCharactersByGroup(Script script, String group) {
        return template.query(withGlyph(LOAD_CHARACTERS_BY_GROUP_SQL, script),
                Map.of("group", group),
                CharacterDaoPG::getCharacterFromResultSet);
    }

    @Override
    public List<KanaCharacter> loadCharacters(Collection<Integer> characterIds) {
        if (characterIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_CHARACTERS_BY_ID_SQL,
                Map.of("characterIds", characterIds),
                CharacterDaoPG::getCharacterFromResultSet);
    }

    @Override
    public Optional<KanaCharacter> loadCharacter(int characterId) {
        return loadCharacters(List.of(characterId)).stream().findFirst();
    }

    @Override
    public List<Integer> loadUntestedCharacterIds(long userId, Script script, boolean audioRequired, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        String sql = LOAD_UNTESTED_CHARACTER_IDS_SQL_SELECT +
                (audioRequired ? AUDIO_PRESENT_SQL : "") +
                LOAD_UNTESTED_CHARACTER_IDS_SQL_ORDER_AND_LIMIT;

        return template.queryForList(withGlyph(sql, script), Map.of("userId", userId, "limit", limit), Integer.class);
    }

    @Override
    public List<Integer> loadWeakestCharacterIds(long userId, Script script, Skill skill, boolean audioRequired, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        String sql = LOAD_WEAKEST_CHARACTER_IDS_SQL_SELECT +
                (audioRequired ? AUDIO_PRESENT_SQL : "") +
                LOAD_WEAKEST_CHARACTER_IDS_SQL_ORDER_AND_LIMIT;

        return template.queryForList(withGlyph(sql, script).replace(SCORE_TOKEN, getScoreColumn(script, skill)),
                Map.of("userId", userId, "limit", limit),
                Integer.class);
    }

    @Override
    public List<String> loadGlyphPool(Script script, boolean audioRequired) {
        String sql = LOAD_GLYPH_POOL_SQL_SELECT + (audioRequired ? AUDIO_PRESENT_SQL : "");

        return template.queryForList(withGlyph(sql, script), new MapSqlParameterSource(), String.class);
    }

    @Override
    public int countCharacters() {
        Integer count = template.queryForObject(COUNT_CHARACTERS_SQL, Map.of(), Integer.class);
        return count == null ? 0 : count;
    }

    private static String withGlyph(String sql, Script script) {
        return sql.replace(GLYPH_TOKEN, script == Script.Hiragana ? "hiragana" : "katakana");
    }

    public static String getScoreColumn(Script script, Skill skill) {
        String prefix = script == Script.Hiragana ? "hiragana_" : "katakana_";
        return switch (skill) {
            case Reading -> prefix + "reading";
            case Writing -> prefix + "writing";
            case Listening -> prefix + "listening";
        };
    }

    private static KanaCharacter getCharacterFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new KanaCharacter(
                rs.getInt("id"),
                rs.getString("consonant"),
                rs.getString("vowel"),
                rs.getString("hiragana"),
                rs.getString("katakana"),
                rs.getString("english_reading"),
                rs.getString("russian_reading"),
                rs.getString("audio"));
    }
}
