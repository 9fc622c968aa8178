package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DueDateProgress(@JsonProperty("id") String id,
                              @JsonProperty("topic") String topic,
                              @JsonProperty("due_date") String dueDate,
                              @JsonProperty("tag") String tag,
                              @JsonProperty("total_cards") int totalCards,
                              @JsonProperty("mastered_cards") int masteredCards,
                              @JsonProperty("progress_percent") double progressPercent,
                              @JsonProperty("days_remaining") double daysRemaining,
                              @JsonProperty("cards_left") int cardsLeft,
                              @JsonProperty("required_pace") double requiredPace) { }
