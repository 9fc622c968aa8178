package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

// Append-only review log entry. cardId is not enforced once the card is deleted.
public record Review(@JsonProperty("id") String id,
                     @JsonProperty("card_id") String cardId,
                     @JsonProperty("rating") Rating rating,
                     @JsonProperty("timestamp") Instant timestamp,
                     @JsonProperty("answer") @JsonInclude(JsonInclude.Include.NON_EMPTY) String answer,
                     @JsonProperty("scheduled_days") long scheduledDays,
                     @JsonProperty("elapsed_days") long elapsedDays,
                     @JsonProperty("state") CardState state) {

    // An empty answer is not written to the file
    public Review {
        answer = answer == null ? "" : answer;
    }
}
