package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CardStats(@JsonProperty("total_cards") int totalCards,
                        @JsonProperty("due_cards") int dueCards,
                        @JsonProperty("reviews_today") int reviewsToday,
                        @JsonProperty("retention_rate") double retentionRate) {

    public static final CardStats EMPTY = new CardStats(0, 0, 0, 0.0);
}
