package com.gt.lrs.dictionary;

import com.gt.lrs.model.WordResult;

import java.time.LocalDate;
import java.util.List;

public interface DictionaryHistoryDao {

    // Ids of words whose next appearance is on or before today, most overdue first
    List<Integer> loadDueWordIds(long userId, LocalDate today, int limit);

    // Sets next appearance to today + period for every result in a single transaction. Periods are not validated here.
    int upsertResults(long userId, List<WordResult> results, LocalDate today);
}
