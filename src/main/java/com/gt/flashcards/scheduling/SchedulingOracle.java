package com.gt.flashcards.scheduling;

import com.gt.flashcards.model.Rating;
import com.gt.flashcards.model.SchedulingState;

import java.time.Instant;

/**
 * Forgetting-curve scheduler consumed by review processing. Implementations must be deterministic and
 * return a complete new state rather than a diff.
 */
public interface SchedulingOracle {

    SchedulingState advance(SchedulingState state, Rating rating, Instant now);
}
