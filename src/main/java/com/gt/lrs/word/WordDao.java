package com.gt.lrs.word;

import com.gt.lrs.model.UserLocale;
import com.gt.lrs.model.WordResponse;

import java.util.Collection;
import java.util.List;

public interface WordDao {

    List<WordResponse> loadWords(Collection<Integer> wordIds, UserLocale locale);

    // Random words the user has never reviewed, skipping excludeIds
    List<Integer> loadUnreviewedWordIds(long userId, Collection<Integer> excludeIds, int limit);

    // Random words of any review state, skipping excludeIds
    List<Integer> loadRandomWordIds(Collection<Integer> excludeIds, int limit);

    int countExistingWords(Collection<Integer> wordIds);
}
