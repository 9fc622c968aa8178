package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TagSummary(@JsonProperty("tag") String tag,
                         @JsonProperty("card_count") int cardCount,
                         @JsonProperty("due_count") int dueCount,
                         @JsonProperty("total_cards") int totalCards,
                         @JsonProperty("due_cards") int dueCards) { }
