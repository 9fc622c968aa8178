package com.gt.flashcards.review;

import com.gt.flashcards.model.CardState;

import java.time.Duration;
import java.time.Instant;

public class ReviewPriorityCalculator {

    static final double NEW_BASE_PRIORITY = 1.0;
    static final double REVIEW_BASE_PRIORITY = 2.0;
    static final double LEARNING_BASE_PRIORITY = 3.0;
    static final double OVERDUE_DAY_FACTOR = 0.1;

    private static final double SECONDS_PER_DAY = 86400.0;

    /**
     * Higher values should be reviewed sooner. Overdue cards grow linearly with the fractional number of
     * days they are overdue. Cards not yet due decay with the days remaining; selection never considers
     * them, the formula is kept for simulating future queues.
     */
    public static double getReviewPriority(CardState state, Instant due, Instant now) {
        double basePriority = getBasePriority(state);
        Duration overdue = Duration.between(due, now);
        double overdueDays = (overdue.getSeconds() + overdue.getNano() / 1e9) / SECONDS_PER_DAY;

        if (overdueDays >= 0) {
            return basePriority * (1.0 + overdueDays * OVERDUE_DAY_FACTOR);
        }

        return basePriority / (1.0 + -overdueDays);
    }

    public static double getBasePriority(CardState state) {
        return switch (state) {
            case New -> NEW_BASE_PRIORITY;
            case Learning, Relearning -> LEARNING_BASE_PRIORITY;
            case Review -> REVIEW_BASE_PRIORITY;
        };
    }
}
