package com.gt.lrs.dictionary;

import com.gt.lrs.exception.NotFoundException;
import com.gt.lrs.exception.ValidationException;
import com.gt.lrs.model.UserLocale;
import com.gt.lrs.model.WordResponse;
import com.gt.lrs.model.WordResult;
import com.gt.lrs.word.WordDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class DictionaryServiceTests {

    private static final long TEST_USER_ID = 42;
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
    private static final Clock TEST_CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Mock private DictionaryHistoryDao dictionaryHistoryDao;
    @Mock private WordDao wordDao;

    private DictionaryService dictionaryService;

    @BeforeEach
    public void setup() {
        dictionaryService = new DictionaryService(dictionaryHistoryDao, wordDao, TEST_CLOCK);

        when(wordDao.loadWords(anyCollection(), any(UserLocale.class))).thenAnswer(invocation -> {
            Collection<Integer> ids = invocation.getArgument(0);
            List<WordResponse> words = new ArrayList<>(ids.stream().map(DictionaryServiceTests::buildWord).toList());
            Collections.reverse(words);     // order returned by the store is not significant
            return words;
        });
    }

    @Test
    public void testBuildSession_DueWordsFirst() {
        List<Integer> dueIds = List.of(5, 3, 9, 1, 7);
        List<Integer> unreviewedIds = ids(100, 30);
        List<Integer> randomIds = ids(200, 5);

        when(dictionaryHistoryDao.loadDueWordIds(TEST_USER_ID, TODAY, 20)).thenReturn(dueIds);
        when(wordDao.loadUnreviewedWordIds(TEST_USER_ID, dueIds, 35)).thenReturn(unreviewedIds);
        when(wordDao.loadRandomWordIds(anyList(), eq(5))).thenReturn(randomIds);

        List<WordResponse> session = dictionaryService.buildSession(TEST_USER_ID, 20, 20, "en");

        assertEquals(40, session.size());
        assertEquals(dueIds, session.subList(0, 5).stream().map(WordResponse::id).toList());
        assertEquals(40, session.stream().map(WordResponse::id).collect(Collectors.toSet()).size());

        Set<Integer> nonDueIds = session.subList(5, 40).stream().map(WordResponse::id).collect(Collectors.toSet());
        Set<Integer> expectedNonDueIds = new HashSet<>(unreviewedIds);
        expectedNonDueIds.addAll(randomIds);
        assertEquals(expectedNonDueIds, nonDueIds);

        List<Integer> expectedExcludedIds = new ArrayList<>(dueIds);
        expectedExcludedIds.addAll(unreviewedIds);
        verify(wordDao).loadRandomWordIds(expectedExcludedIds, 5);
        verify(wordDao).loadWords(anyCollection(), eq(UserLocale.En));
    }

    @Test
    public void testBuildSession_EnoughUnreviewedWords() {
        when(dictionaryHistoryDao.loadDueWordIds(TEST_USER_ID, TODAY, 10)).thenReturn(List.of());
        when(wordDao.loadUnreviewedWordIds(TEST_USER_ID, List.of(), 25)).thenReturn(ids(1, 25));

        List<WordResponse> session = dictionaryService.buildSession(TEST_USER_ID, 15, 10, "ru");

        assertEquals(ids(1, 25), session.stream().map(WordResponse::id).toList());
        verify(wordDao, never()).loadRandomWordIds(anyCollection(), anyInt());
        verify(wordDao).loadWords(anyCollection(), eq(UserLocale.Ru));
    }

    @Test
    public void testBuildSession_SmallCatalog() {
        when(dictionaryHistoryDao.loadDueWordIds(TEST_USER_ID, TODAY, 10)).thenReturn(List.of(1, 2));
        when(wordDao.loadUnreviewedWordIds(TEST_USER_ID, List.of(1, 2), 18)).thenReturn(List.of(3));
        when(wordDao.loadRandomWordIds(List.of(1, 2, 3), 17)).thenReturn(List.of(4, 5));

        List<WordResponse> session = dictionaryService.buildSession(TEST_USER_ID, 10, 10, "de");

        assertEquals(List.of(1, 2, 3, 4, 5), session.stream().map(WordResponse::id).toList());
        verify(wordDao).loadWords(anyCollection(), eq(UserLocale.De));
    }

    @Test
    public void testBuildSession_InvalidCounts() {
        assertThrows(ValidationException.class, () -> dictionaryService.buildSession(TEST_USER_ID, 9, 20, "en"));
        assertThrows(ValidationException.class, () -> dictionaryService.buildSession(TEST_USER_ID, 41, 20, "en"));
        assertThrows(ValidationException.class, () -> dictionaryService.buildSession(TEST_USER_ID, 20, 9, "en"));
        assertThrows(ValidationException.class, () -> dictionaryService.buildSession(TEST_USER_ID, 20, 41, "en"));

        verifyNoInteractions(dictionaryHistoryDao);
    }

    @Test
    public void testBuildSession_InvalidLocale() {
        assertThrows(ValidationException.class, () -> dictionaryService.buildSession(TEST_USER_ID, 20, 20, "fr"));
        assertThrows(ValidationException.class, () -> dictionaryService.buildSession(TEST_USER_ID, 20, 20, null));

        verifyNoInteractions(dictionaryHistoryDao);
    }

    @Test
    public void testSubmitWordResults() {
        List<WordResult> results = List.of(new WordResult(1, 1), new WordResult(2, 30));
        when(wordDao.countExistingWords(Set.of(1, 2))).thenReturn(2);
        when(dictionaryHistoryDao.upsertResults(TEST_USER_ID, results, TODAY)).thenReturn(2);

        assertEquals(2, dictionaryService.submitWordResults(TEST_USER_ID, results));

        verify(dictionaryHistoryDao).upsertResults(TEST_USER_ID, results, TODAY);
    }

    @Test
    public void testSubmitWordResults_InvalidPeriods() {
        assertThrows(ValidationException.class, () -> dictionaryService.submitWordResults(TEST_USER_ID, List.of(new WordResult(1, 0))));
        assertThrows(ValidationException.class, () -> dictionaryService.submitWordResults(TEST_USER_ID, List.of(new WordResult(1, 31))));
        assertThrows(ValidationException.class, () -> dictionaryService.submitWordResults(TEST_USER_ID, List.of(new WordResult(1, null))));
        assertThrows(ValidationException.class, () -> dictionaryService.submitWordResults(TEST_USER_ID, List.of(new WordResult(null, 5))));

        verifyNoInteractions(dictionaryHistoryDao);
    }

    @Test
    public void testSubmitWordResults_EmptyBatch() {
        assertThrows(ValidationException.class, () -> dictionaryService.submitWordResults(TEST_USER_ID, List.of()));
        assertThrows(ValidationException.class, () -> dictionaryService.submitWordResults(TEST_USER_ID, null));

        verifyNoInteractions(dictionaryHistoryDao);
    }

    @Test
    public void testSubmitWordResults_UnknownWord() {
        when(wordDao.countExistingWords(Set.of(1, 999))).thenReturn(1);

        assertThrows(NotFoundException.class, () -> dictionaryService.submitWordResults(TEST_USER_ID, List.of(new WordResult(1, 3), new WordResult(999, 3))));

        verify(dictionaryHistoryDao, never()).upsertResults(anyLong(), anyList(), any(LocalDate.class));
    }

    private static List<Integer> ids(int start, int cnt) {
        return IntStream.range(start, start + cnt).boxed().toList();
    }

    private static WordResponse buildWord(int id) {
        return new WordResponse(id, "word" + id, "clue" + id, "translation" + id, "example" + id, "exampleTranslation" + id, 1, 3, 7, 14);
    }
}
