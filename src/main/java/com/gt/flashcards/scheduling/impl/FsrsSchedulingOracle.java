package com.gt.flashcards.scheduling.impl;

import com.gt.flashcards.model.CardState;
import com.gt.flashcards.model.Rating;
import com.gt.flashcards.model.SchedulingState;
import com.gt.flashcards.scheduling.SchedulingOracle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

// FSRS v4.5 scheduler with the default weight set.
@Component
public class FsrsSchedulingOracle implements SchedulingOracle {

    static final double[] DEFAULT_WEIGHTS = new double[]{
            0.4, 0.6, 2.4, 5.8, 4.93, 0.94, 0.86, 0.01, 1.49, 0.14, 0.94, 2.18, 0.05, 0.34, 1.26, 0.29, 2.61
    };

    private static final double DECAY = -0.5;
    private static final double FACTOR = Math.pow(0.9, 1.0 / DECAY) - 1.0;

    private static final Duration NEW_AGAIN_DELAY = Duration.ofMinutes(1);
    private static final Duration NEW_HARD_DELAY = Duration.ofMinutes(5);
    private static final Duration NEW_GOOD_DELAY = Duration.ofMinutes(10);
    private static final Duration AGAIN_DELAY = Duration.ofMinutes(5);
    private static final Duration HARD_STEP_DELAY = Duration.ofMinutes(10);

    private final double[] w;
    private final double requestRetention;
    private final long maximumIntervalDays;

    @Autowired
    public FsrsSchedulingOracle(@Value("${flashcards.fsrs.requestRetention:0.9}") double requestRetention,
                                @Value("${flashcards.fsrs.maximumIntervalDays:36500}") long maximumIntervalDays) {
        this(DEFAULT_WEIGHTS, requestRetention, maximumIntervalDays);
    }

    FsrsSchedulingOracle(double[] w, double requestRetention, long maximumIntervalDays) {
        this.w = w.clone();
        this.requestRetention = requestRetention;
        this.maximumIntervalDays = maximumIntervalDays;
    }

    @Override
    public SchedulingState advance(SchedulingState state, Rating rating, Instant now) {
        return switch (state.state()) {
            case New -> advanceNew(state, rating, now);
            case Learning, Relearning -> advanceLearning(state, rating, now);
            case Review -> advanceReview(state, rating, now);
        };
    }

    private SchedulingState advanceNew(SchedulingState state, Rating rating, Instant now) {
        double stability = initStability(rating);
        double difficulty = initDifficulty(rating);

        return switch (rating) {
            case Again -> next(state, now, CardState.Learning, stability, difficulty, 0, now.plus(NEW_AGAIN_DELAY), 0, 0);
            case Hard -> next(state, now, CardState.Learning, stability, difficulty, 0, now.plus(NEW_HARD_DELAY), 0, 0);
            case Good -> next(state, now, CardState.Learning, stability, difficulty, 0, now.plus(NEW_GOOD_DELAY), 0, 0);
            case Easy -> {
                long easyInterval = nextInterval(stability);
                yield next(state, now, CardState.Review, stability, difficulty, easyInterval, now.plus(Duration.ofDays(easyInterval)), 0, 0);
            }
        };
    }

    // Learning steps keep stability and difficulty; only Good and Easy graduate the card.
    private SchedulingState advanceLearning(SchedulingState state, Rating rating, Instant now) {
        double stability = state.stability();
        double difficulty = state.difficulty();
        long elapsedDays = state.elapsedDays();

        long goodInterval = nextInterval(stability);
        long easyInterval = Math.max(nextInterval(stability), goodInterval + 1);

        return switch (rating) {
            case Again -> next(state, now, state.state(), stability, difficulty, 0, now.plus(AGAIN_DELAY), elapsedDays, 0);
            case Hard -> next(state, now, state.state(), stability, difficulty, 0, now.plus(HARD_STEP_DELAY), elapsedDays, 0);
            case Good -> next(state, now, CardState.Review, stability, difficulty, goodInterval, now.plus(Duration.ofDays(goodInterval)), elapsedDays, 0);
            case Easy -> next(state, now, CardState.Review, stability, difficulty, easyInterval, now.plus(Duration.ofDays(easyInterval)), elapsedDays, 0);
        };
    }

    private SchedulingState advanceReview(SchedulingState state, Rating rating, Instant now) {
        long elapsedDays = state.elapsedDays();
        double lastStability = state.stability();
        double lastDifficulty = state.difficulty();
        double retrievability = forgettingCurve(elapsedDays, lastStability);

        double difficulty = nextDifficulty(lastDifficulty, rating);

        if (rating == Rating.Again) {
            double stability = nextForgetStability(difficulty, lastStability, retrievability);
            return next(state, now, CardState.Relearning, stability, difficulty, 0, now.plus(AGAIN_DELAY), elapsedDays, 1);
        }

        double hardStability = nextRecallStability(nextDifficulty(lastDifficulty, Rating.Hard), lastStability, retrievability, Rating.Hard);
        double goodStability = nextRecallStability(nextDifficulty(lastDifficulty, Rating.Good), lastStability, retrievability, Rating.Good);
        double easyStability = nextRecallStability(nextDifficulty(lastDifficulty, Rating.Easy), lastStability, retrievability, Rating.Easy);

        long hardInterval = nextInterval(hardStability);
        long goodInterval = nextInterval(goodStability);
        hardInterval = Math.min(hardInterval, goodInterval);
        goodInterval = Math.max(goodInterval, hardInterval + 1);
        long easyInterval = Math.max(nextInterval(easyStability), goodInterval + 1);

        return switch (rating) {
            case Hard -> next(state, now, CardState.Review, hardStability, difficulty, hardInterval, now.plus(Duration.ofDays(hardInterval)), elapsedDays, 0);
            case Good -> next(state, now, CardState.Review, goodStability, difficulty, goodInterval, now.plus(Duration.ofDays(goodInterval)), elapsedDays, 0);
            default -> next(state, now, CardState.Review, easyStability, difficulty, easyInterval, now.plus(Duration.ofDays(easyInterval)), elapsedDays, 0);
        };
    }

    private SchedulingState next(SchedulingState previous, Instant now, CardState newState, double stability, double difficulty,
                                 long scheduledDays, Instant due, long elapsedDays, int lapseIncrement) {
        return new SchedulingState(due, stability, difficulty, elapsedDays, scheduledDays,
                previous.reps() + 1, previous.lapses() + lapseIncrement, newState, now);
    }

    double initStability(Rating rating) {
        return Math.max(w[rating.getRatingValue() - 1], 0.1);
    }

    double initDifficulty(Rating rating) {
        return constrainDifficulty(w[4] - w[5] * (rating.getRatingValue() - 3));
    }

    long nextInterval(double stability) {
        double interval = stability / FACTOR * (Math.pow(requestRetention, 1.0 / DECAY) - 1.0);
        return Math.min(Math.max(Math.round(interval), 1), maximumIntervalDays);
    }

    double forgettingCurve(long elapsedDays, double stability) {
        return Math.pow(1.0 + FACTOR * elapsedDays / stability, DECAY);
    }

    private double nextDifficulty(double difficulty, Rating rating) {
        double next = difficulty - w[6] * (rating.getRatingValue() - 3);
        return constrainDifficulty(w[7] * w[4] + (1.0 - w[7]) * next);
    }

    private double nextRecallStability(double difficulty, double stability, double retrievability, Rating rating) {
        double hardPenalty = rating == Rating.Hard ? w[15] : 1.0;
        double easyBonus = rating == Rating.Easy ? w[16] : 1.0;

        return stability * (1.0 + Math.exp(w[8])
                * (11.0 - difficulty)
                * Math.pow(stability, -w[9])
                * (Math.exp((1.0 - retrievability) * w[10]) - 1.0)
                * hardPenalty
                * easyBonus);
    }

    private double nextForgetStability(double difficulty, double stability, double retrievability) {
        return w[11]
                * Math.pow(difficulty, -w[12])
                * (Math.pow(stability + 1.0, w[13]) - 1.0)
                * Math.exp((1.0 - retrievability) * w[14]);
    }

    private static double constrainDifficulty(double difficulty) {
        return Math.min(Math.max(difficulty, 1.0), 10.0);
    }
}
