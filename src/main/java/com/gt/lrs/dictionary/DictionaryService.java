package com.gt.lrs.dictionary;

import com.gt.lrs.exception.NotFoundException;
import com.gt.lrs.exception.ValidationException;
import com.gt.lrs.model.UserLocale;
import com.gt.lrs.model.WordResponse;
import com.gt.lrs.model.WordResult;
import com.gt.lrs.util.ParamParser;
import com.gt.lrs.word.WordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds vocabulary review sessions and records their results.
 * <p>
 * Every word carries four fixed review periods (easy, normal, hard, extra hard). The client picks one of them after
 * each review and the word becomes due again that many days later. There is no backoff beyond that choice.
 */
@Component
public class DictionaryService {

    private static final Logger log = LoggerFactory.getLogger(DictionaryService.class);

    static final int MIN_SESSION_WORD_CNT = 10;
    static final int MAX_SESSION_WORD_CNT = 40;
    static final int MIN_PERIOD_DAYS = 1;
    static final int MAX_PERIOD_DAYS = 30;

    private final DictionaryHistoryDao dictionaryHistoryDao;
    private final WordDao wordDao;
    private final Clock clock;

    @Autowired
    public DictionaryService(DictionaryHistoryDao dictionaryHistoryDao,
                             WordDao wordDao,
                             Clock clock) {
        this.dictionaryHistoryDao = dictionaryHistoryDao;
        this.wordDao = wordDao;
        this.clock = clock;
    }

    public List<WordResponse> buildSession(long userId, int newCnt, int oldCnt, String localeId) {
        validateSessionWordCnt("newCount", newCnt);
        validateSessionWordCnt("oldCount", oldCnt);
        UserLocale locale = ParamParser.parseLocale(localeId);

        List<Integer> dueWordIds = dictionaryHistoryDao.loadDueWordIds(userId, LocalDate.now(clock), oldCnt);

        Set<Integer> selectedIds = new LinkedHashSet<>(dueWordIds);
        int targetNewCnt = newCnt + (oldCnt - selectedIds.size());

        selectedIds.addAll(wordDao.loadUnreviewedWordIds(userId, List.copyOf(selectedIds), targetNewCnt));

        int remainingCnt = newCnt + oldCnt - selectedIds.size();
        if (remainingCnt > 0) {
            selectedIds.addAll(wordDao.loadRandomWordIds(List.copyOf(selectedIds), remainingCnt));
        }

        Map<Integer, WordResponse> wordsById = wordDao.loadWords(selectedIds, locale)
                .stream()
                .collect(Collectors.toMap(WordResponse::id, Function.identity()));

        List<WordResponse> session = new ArrayList<>(selectedIds.size());
        for (Integer wordId : selectedIds) {
            WordResponse word = wordsById.get(wordId);
            if (word != null) {
                session.add(word);
            }
        }

        log.debug("Built session for user {} with {} due and {} new words", userId, dueWordIds.size(), session.size() - dueWordIds.size());
        return session;
    }

    public int submitWordResults(long userId, List<WordResult> results) {
        if (results == null || results.isEmpty()) {
            throw new ValidationException("Results list cannot be empty");
        }

        Set<Integer> wordIds = new LinkedHashSet<>();
        for (WordResult result : results) {
            if (result == null || result.wordId() == null) {
                throw new ValidationException("Every result must have a word id");
            }
            if (result.period() == null) {
                throw new ValidationException("Period is required for word " + result.wordId());
            }
            if (result.period() < MIN_PERIOD_DAYS || result.period() > MAX_PERIOD_DAYS) {
                throw new ValidationException("Period must be between " + MIN_PERIOD_DAYS + " and " + MAX_PERIOD_DAYS + ", got: " + result.period());
            }
            wordIds.add(result.wordId());
        }

        if (wordDao.countExistingWords(wordIds) != wordIds.size()) {
            throw new NotFoundException("One or more word ids do not exist");
        }

        int savedCnt = dictionaryHistoryDao.upsertResults(userId, results, LocalDate.now(clock));
        log.info("Saved {} word results for user {}", savedCnt, userId);

        return savedCnt;
    }

    private static void validateSessionWordCnt(String name, int cnt) {
        if (cnt < MIN_SESSION_WORD_CNT || cnt > MAX_SESSION_WORD_CNT) {
            throw new ValidationException(name + " must be between " + MIN_SESSION_WORD_CNT + " and " + MAX_SESSION_WORD_CNT);
        }
    }
}
