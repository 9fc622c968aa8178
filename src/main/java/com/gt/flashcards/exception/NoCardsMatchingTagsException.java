package com.gt.flashcards.exception;

import com.gt.flashcards.model.CardStats;

import java.util.List;

public class NoCardsMatchingTagsException extends StatsCarryingException {

    public NoCardsMatchingTagsException(List<String> filterTags, CardStats stats) {
        super("No cards found with the specified tags: " + filterTags, filterTags, stats);
    }
}
