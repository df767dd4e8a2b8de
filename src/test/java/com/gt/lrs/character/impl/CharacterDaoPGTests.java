package com.gt.lrs.character.impl;

import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(SpringExtension.class)
public class CharacterDaoPGTests {

    @Mock private NamedParameterJdbcTemplate template;

    private CharacterDaoPG characterDao;

    @BeforeEach
    public void setup() {
        characterDao = new CharacterDaoPG(template);
    }

    @Test
    public void testLoadWeakestCharacterIds_Listening() {
        characterDao.loadWeakestCharacterIds(1, Script.Katakana, Skill.Listening, true, 5);

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(template).queryForList(sqlCaptor.capture(), anyMap(), eq(Integer.class));

        String sql = sqlCaptor.getValue();
        assertTrue(sql.contains("ORDER BY m.katakana_listening ASC"));
        assertTrue(sql.contains("c.audio IS NOT NULL"));
        assertFalse(sql.contains("$"));
    }

    @Test
    public void testLoadUntestedCharacterIds_Reading() {
        characterDao.loadUntestedCharacterIds(1, Script.Hiragana, false, 5);

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(template).queryForList(sqlCaptor.capture(), eq(Map.of("userId", 1L, "limit", 5)), eq(Integer.class));

        String sql = sqlCaptor.getValue();
        assertTrue(sql.contains("m.character_id IS NULL"));
        assertTrue(sql.contains("c.hiragana IS NOT NULL"));
        assertFalse(sql.contains("c.audio"));
    }

    @Test
    public void testNothingRequested() {
        assertEquals(List.of(), characterDao.loadUntestedCharacterIds(1, Script.Hiragana, false, 0));
        assertEquals(List.of(), characterDao.loadWeakestCharacterIds(1, Script.Hiragana, Skill.Reading, false, 0));
        assertEquals(List.of(), characterDao.loadCharacters(List.of()));

        verifyNoInteractions(template);
    }
}
