package com.gt.lrs.character;

import com.gt.lrs.model.CharacterResponse;
import com.gt.lrs.model.CharacterTestItem;
import com.gt.lrs.model.KanaCharacter;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/rest/characters")
public class CharacterController {

    private static final String DEFAULT_LOCALE = "en";

    private final CharacterService characterService;

    public CharacterController(CharacterService characterService) {
        this.characterService = characterService;
    }

    @GetMapping(value = "id/{characterId}", produces = "application/json")
    public KanaCharacter getCharacter(@PathVariable("characterId") int characterId) {
        return characterService.getCharacter(characterId);
    }

    @GetMapping(value = "{script}", produces = "application/json")
    public List<CharacterResponse> listCharacters(@PathVariable("script") String script,
                                                  @RequestParam(value = "locale", defaultValue = DEFAULT_LOCALE) String locale) {
        return characterService.listCharacters(script, locale);
    }

    @GetMapping(value = "{script}/group/{group}", produces = "application/json")
    public List<CharacterResponse> listCharactersByGroup(@PathVariable("script") String script,
                                                         @PathVariable("group") String group,
                                                         @RequestParam(value = "locale", defaultValue = DEFAULT_LOCALE) String locale) {
        return characterService.listCharactersByGroup(script, locale, group);
    }

    @GetMapping(value = "{script}/test/{skill}", produces = "application/json")
    public List<CharacterTestItem> buildTest(@PathVariable("script") String script,
                                             @PathVariable("skill") String skill,
                                             @RequestParam(value = "locale", defaultValue = DEFAULT_LOCALE) String locale,
                                             @RequestParam(value = "count", required = false) Integer count,
                                             @AuthenticationPrincipal Long userId) {
        return characterService.buildTest(userId, script, skill, locale, count);
    }
}
