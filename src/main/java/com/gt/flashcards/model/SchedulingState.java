package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SchedulingState(@JsonProperty("Due") Instant due,
                              @JsonProperty("Stability") double stability,
                              @JsonProperty("Difficulty") double difficulty,
                              @JsonProperty("ElapsedDays") long elapsedDays,
                              @JsonProperty("ScheduledDays") long scheduledDays,
                              @JsonProperty("Reps") long reps,
                              @JsonProperty("Lapses") long lapses,
                              @JsonProperty("State") CardState state,
                              @JsonProperty("LastReview") @JsonInclude(JsonInclude.Include.NON_NULL) Instant lastReview) {

    public SchedulingState {
        if (state == null) {
            state = CardState.New;
        }
    }

    public static SchedulingState newCard(Instant due) {
        return new SchedulingState(due, 0, 0, 0, 0, 0, 0, CardState.New, null);
    }

    public boolean isDue(Instant now) {
        return !due.isAfter(now);
    }

    public SchedulingState withDue(Instant newDue) {
        return new SchedulingState(newDue, stability, difficulty, elapsedDays, scheduledDays, reps, lapses, state, lastReview);
    }

    public SchedulingState withElapsedDays(long newElapsedDays) {
        return new SchedulingState(due, stability, difficulty, newElapsedDays, scheduledDays, reps, lapses, state, lastReview);
    }
}
