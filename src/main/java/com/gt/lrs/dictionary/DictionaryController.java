package com.gt.lrs.dictionary;

import com.gt.lrs.model.WordResponse;
import com.gt.lrs.model.WordResult;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/rest/dictionary")
public class DictionaryController {

    private final DictionaryService dictionaryService;

    public DictionaryController(DictionaryService dictionaryService) {
        this.dictionaryService = dictionaryService;
    }

    @PostMapping(value = "session", consumes = "application/json", produces = "application/json")
    public List<WordResponse> buildSession(@RequestBody BuildSessionRequest request,
                                           @AuthenticationPrincipal Long userId) {
        return dictionaryService.buildSession(userId, request.newCount(), request.oldCount(), request.locale());
    }

    @PostMapping(value = "results", consumes = "application/json")
    public void submitWordResults(@RequestBody List<WordResult> results,
                                  @AuthenticationPrincipal Long userId) {
        dictionaryService.submitWordResults(userId, results);
    }

    private record BuildSessionRequest(int newCount, int oldCount, String locale) { }
}
