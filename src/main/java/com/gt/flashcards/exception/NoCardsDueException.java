package com.gt.flashcards.exception;

import com.gt.flashcards.model.CardStats;

import java.util.List;

public class NoCardsDueException extends StatsCarryingException {

    public NoCardsDueException(List<String> filterTags, CardStats stats) {
        super(filterTags.isEmpty()
                        ? "No cards due for review"
                        : "No cards due for review with the specified tags: " + filterTags,
                filterTags,
                stats);
    }

    public boolean isTagFiltered() {
        return !getFilterTags().isEmpty();
    }
}
