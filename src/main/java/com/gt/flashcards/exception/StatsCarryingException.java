package com.gt.flashcards.exception;

import com.gt.flashcards.model.CardStats;

import java.util.List;

// Due card selection failures still report the aggregate stats over all cards
public abstract class StatsCarryingException extends RuntimeException {

    private final List<String> filterTags;
    private final CardStats stats;

    protected StatsCarryingException(String msg, List<String> filterTags, CardStats stats) {
        super(msg);

        this.filterTags = List.copyOf(filterTags);
        this.stats = stats;
    }

    public List<String> getFilterTags() {
        return filterTags;
    }

    public CardStats getStats() {
        return stats;
    }
}
