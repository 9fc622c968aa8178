package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

public record Card(@JsonProperty("id") String id,
                   @JsonProperty("front") String front,
                   @JsonProperty("back") String back,
                   @JsonProperty("created_at") Instant createdAt,
                   @JsonProperty("tags") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> tags,
                   @JsonProperty("last_reviewed_at") @JsonInclude(JsonInclude.Include.NON_NULL) Instant lastReviewedAt,
                   @JsonProperty("fsrs") SchedulingState fsrs) {

    public Card {
        tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
    }

    public static Card newCard(String id, String front, String back, List<String> tags, Instant now) {
        return new Card(id, front, back, now, tags, null, SchedulingState.newCard(now));
    }

    public boolean isDue(Instant now) {
        return fsrs.isDue(now);
    }

    public Card withContent(String newFront, String newBack, List<String> newTags) {
        return new Card(id, newFront, newBack, createdAt, newTags, lastReviewedAt, fsrs);
    }

    public Card withSchedulingState(SchedulingState newState) {
        return new Card(id, front, back, createdAt, tags, lastReviewedAt, newState);
    }

    public Card withReview(SchedulingState newState, Instant reviewedAt) {
        return new Card(id, front, back, createdAt, tags, reviewedAt, newState);
    }
}
