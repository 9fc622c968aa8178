package com.gt.flashcards.review;

import com.gt.flashcards.exception.ValidationException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.Rating;
import com.gt.flashcards.model.Review;
import com.gt.flashcards.model.SchedulingState;
import com.gt.flashcards.scheduling.SchedulingOracle;
import com.gt.flashcards.storage.FlashcardStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;

@Component
public class ReviewProcessor {

    private static final Logger log = LoggerFactory.getLogger(ReviewProcessor.class);

    private static final long SECONDS_PER_DAY = 86400;

    private final FlashcardStorage flashcardStorage;
    private final SchedulingOracle schedulingOracle;
    private final Clock clock;

    @Autowired
    public ReviewProcessor(FlashcardStorage flashcardStorage, SchedulingOracle schedulingOracle, Clock clock) {
        this.flashcardStorage = flashcardStorage;
        this.schedulingOracle = schedulingOracle;
        this.clock = clock;
    }

    public Card submitReview(String cardId, Rating rating, String answer) {
        return submitReview(cardId, rating, answer, clock.instant());
    }

    /**
     * Applies a rating to a card and records the review. The whole read-schedule-write-save sequence runs
     * under the storage's exclusive lock, so concurrent reviews of the same card cannot overwrite each
     * other. A failure part way through is not rolled back: the card may already be updated in memory
     * when appending the review or saving fails.
     */
    public Card submitReview(String cardId, Rating rating, String answer, Instant now) {
        if (cardId == null || cardId.isBlank()) {
            throw new ValidationException("Missing required parameter: card_id");
        }
        if (rating == null) {
            throw new ValidationException("Missing required parameter: rating");
        }

        return flashcardStorage.executeExclusively(() -> applyReview(cardId, rating, answer, now));
    }

    private Card applyReview(String cardId, Rating rating, String answer, Instant now) {
        Card card = flashcardStorage.getCard(cardId);
        SchedulingState currentState = card.fsrs();

        Optional<Instant> lastReviewTime = flashcardStorage.getCardReviews(cardId)
                .stream()
                .map(Review::timestamp)
                .max(Comparator.naturalOrder());
        if (lastReviewTime.isPresent()) {
            long elapsedDays = getElapsedDays(lastReviewTime.get(), now);
            log.debug("Card {} last reviewed at {}, {} elapsed days", cardId, lastReviewTime.get(), elapsedDays);

            currentState = currentState.withElapsedDays(elapsedDays);
        }

        SchedulingState newState = schedulingOracle.advance(currentState, rating, now);
        log.debug("Card {} rated {}: {} -> {}, due {}", cardId, rating, currentState.state(), newState.state(), newState.due());

        Card updatedCard = card.withReview(newState, now);
        flashcardStorage.updateCard(updatedCard);

        flashcardStorage.addReview(new Review(UUID.randomUUID().toString(), cardId, rating, now, answer,
                newState.scheduledDays(), newState.elapsedDays(), newState.state()));

        flashcardStorage.save();

        return updatedCard;
    }

    static long getElapsedDays(Instant lastReviewTime, Instant now) {
        return Math.max(0, Math.floorDiv(Duration.between(lastReviewTime, now).getSeconds(), SECONDS_PER_DAY));
    }
}
