package com.gt.lrs.character;

import com.gt.lrs.exception.NotFoundException;
import com.gt.lrs.exception.ValidationException;
import com.gt.lrs.model.CharacterResponse;
import com.gt.lrs.model.CharacterTestItem;
import com.gt.lrs.model.KanaCharacter;
import com.gt.lrs.model.ListeningTestItem;
import com.gt.lrs.model.ReadingTestItem;
import com.gt.lrs.model.Script;
import com.gt.lrs.model.Skill;
import com.gt.lrs.model.UserLocale;
import com.gt.lrs.model.WritingTestItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.gt.lrs.util.ParamParser.parseLocale;
import static com.gt.lrs.util.ParamParser.parseScript;
import static com.gt.lrs.util.ParamParser.parseSkill;

@Component
public class CharacterService {

    private static final Logger log = LoggerFactory.getLogger(CharacterService.class);

    static final int DISTRACTOR_CNT = 2;

    private final CharacterDao characterDao;
    private final Random random;
    private final int defaultTestSize;

    @Autowired
    public CharacterService(CharacterDao characterDao,
                            Random random,
                            @Value("${lrs.character.defaultTestSize:10}") int defaultTestSize) {
        this.characterDao = characterDao;
        this.random = random;
        this.defaultTestSize = defaultTestSize;
    }

    public List<CharacterResponse> listCharacters(String scriptId, String localeId) {
        Script script = parseScript(scriptId);
        UserLocale locale = parseLocale(localeId);

        return toResponses(characterDao.loadCharacters(script), script, locale);
    }

    public List<CharacterResponse> listCharactersByGroup(String scriptId, String localeId, String group) {
        Script script = parseScript(scriptId);
        UserLocale locale = parseLocale(localeId);
        if (group == null || group.isBlank()) {
            throw new ValidationException("Consonant or vowel group is required");
        }

        return toResponses(characterDao.loadCharactersByGroup(script, group.trim()), script, locale);
    }

    public KanaCharacter getCharacter(int characterId) {
        if (characterId <= 0) {
            throw new ValidationException("Invalid character id: " + characterId);
        }

        return characterDao.loadCharacter(characterId)
                .orElseThrow(() -> new NotFoundException("Character " + characterId + " not found"));
    }

    /**
     * Picks up to {@code count} characters to test. Characters the user has never been tested on come first, the
     * remaining slots go to the characters with the lowest score for the script and skill.
     *
     * @param count number of items wanted, {@code null} for the configured default
     */
    public List<CharacterTestItem> buildTest(long userId, String scriptId, String skillId, String localeId, Integer count) {
        Script script = parseScript(scriptId);
        Skill skill = parseSkill(skillId);
        UserLocale locale = parseLocale(localeId);
        int testSize = count == null ? defaultTestSize : count;
        if (testSize <= 0) {
            throw new ValidationException("Count must be a positive number, got: " + testSize);
        }

        boolean audioRequired = skill == Skill.Listening;

        List<Integer> characterIds = new ArrayList<>(characterDao.loadUntestedCharacterIds(userId, script, audioRequired, testSize));
        if (characterIds.size() < testSize) {
            characterIds.addAll(characterDao.loadWeakestCharacterIds(userId, script, skill, audioRequired, testSize - characterIds.size()));
        }

        Map<Integer, KanaCharacter> charactersById = characterDao.loadCharacters(characterIds)
                .stream()
                .collect(Collectors.toMap(KanaCharacter::id, Function.identity()));

        List<String> glyphPool = skill.isMultipleChoice() ? characterDao.loadGlyphPool(script, audioRequired) : List.of();

        List<CharacterTestItem> items = new ArrayList<>(characterIds.size());
        for (Integer characterId : characterIds) {
            KanaCharacter character = charactersById.get(characterId);
            if (character != null) {
                items.add(buildTestItem(character, script, skill, locale, glyphPool));
            }
        }

        return items;
    }

    private CharacterTestItem buildTestItem(KanaCharacter character, Script script, Skill skill, UserLocale locale, List<String> glyphPool) {
        String glyph = character.getGlyph(script);

        return switch (skill) {
            case Reading -> new ReadingTestItem(character.id(), character.getReading(locale), glyph, drawDistractors(glyph, glyphPool));
            case Listening -> new ListeningTestItem(character.id(), character.audio(), glyph, drawDistractors(glyph, glyphPool));
            case Writing -> new WritingTestItem(character.id(), glyph, character.getReading(locale));
        };
    }

    // Partial Fisher-Yates over the pool with the correct glyph removed
    List<String> drawDistractors(String correctGlyph, List<String> glyphPool) {
        List<String> candidates = glyphPool.stream()
                .filter(glyph -> !glyph.equals(correctGlyph))
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));

        if (candidates.size() < DISTRACTOR_CNT) {
            log.warn("Only {} distractors available for character {}", candidates.size(), correctGlyph);
        }

        int distractorCnt = Math.min(DISTRACTOR_CNT, candidates.size());
        for (int index = 0; index < distractorCnt; index++) {
            int swapIndex = index + random.nextInt(candidates.size() - index);
            String swap = candidates.get(index);
            candidates.set(index, candidates.get(swapIndex));
            candidates.set(swapIndex, swap);
        }

        return List.copyOf(candidates.subList(0, distractorCnt));
    }

    private static List<CharacterResponse> toResponses(List<KanaCharacter> characters, Script script, UserLocale locale) {
        return characters.stream()
                .map(character -> CharacterResponse.fromCharacter(character, script, locale))
                .toList();
    }
}
