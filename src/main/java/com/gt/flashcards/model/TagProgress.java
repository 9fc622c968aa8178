package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TagProgress(@JsonProperty("total_cards") int totalCards,
                          @JsonProperty("mastered_cards") int masteredCards,
                          @JsonProperty("progress_percent") double progressPercent) {

    public static final TagProgress EMPTY = new TagProgress(0, 0, 0.0);
}
