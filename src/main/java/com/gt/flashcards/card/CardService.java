package com.gt.flashcards.card;

import com.gt.flashcards.exception.StorageException;
import com.gt.flashcards.exception.ValidationException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardList;
import com.gt.flashcards.model.CardStats;
import com.gt.flashcards.model.Review;
import com.gt.flashcards.stats.StatsService;
import com.gt.flashcards.storage.FlashcardStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Component
public class CardService {

    private static final Logger log = LoggerFactory.getLogger(CardService.class);

    private static final long SECONDS_PER_HOUR = 3600;

    private final FlashcardStorage flashcardStorage;
    private final StatsService statsService;
    private final Clock clock;

    @Autowired
    public CardService(FlashcardStorage flashcardStorage, StatsService statsService, Clock clock) {
        this.flashcardStorage = flashcardStorage;
        this.statsService = statsService;
        this.clock = clock;
    }

    public Card createCard(String front, String back, List<String> tags) {
        return createCard(front, back, tags, null);
    }

    // hourOffset moves the initial due time relative to now, e.g. -1 makes the card an hour overdue
    public Card createCard(String front, String back, List<String> tags, Double hourOffset) {
        if (front == null) {
            throw new ValidationException("Missing required parameter: front");
        }
        if (back == null) {
            throw new ValidationException("Missing required parameter: back");
        }

        validateTags(tags);

        Card card = flashcardStorage.createCard(front, back, tags);
        log.debug("Created card {} with tags {}", card.id(), card.tags());

        if (hourOffset != null) {
            Duration offset = Duration.ofSeconds(Math.round(hourOffset * SECONDS_PER_HOUR));
            card = card.withSchedulingState(card.fsrs().withDue(clock.instant().plus(offset)));
            flashcardStorage.updateCard(card);
        }

        // The card stays usable in memory even when it could not be persisted yet
        try {
            flashcardStorage.save();
        } catch (StorageException ex) {
            log.warn("Failed to save storage after creating card {}, card exists in memory only", card.id(), ex);
        }

        return card;
    }

    public Card getCard(String cardId) {
        return flashcardStorage.getCard(cardId);
    }

    // Only non-null fields are applied. Nothing is written when the card is unchanged.
    public Card updateCard(String cardId, String front, String back, List<String> tags) {
        validateTags(tags);

        Card card = flashcardStorage.getCard(cardId);

        Card updatedCard = card.withContent(
                front != null ? front : card.front(),
                back != null ? back : card.back(),
                tags != null ? tags : card.tags());

        if (!updatedCard.equals(card)) {
            flashcardStorage.updateCard(updatedCard);
            flashcardStorage.save();

            log.debug("Updated card {}", cardId);
        }

        return updatedCard;
    }

    public void deleteCard(String cardId) {
        flashcardStorage.deleteCard(cardId);
        flashcardStorage.save();

        log.info("Deleted card {}", cardId);
    }

    public CardList listCards(List<String> anyOfTags, boolean includeStats) {
        List<Card> cards = flashcardStorage.listCards(anyOfTags);
        CardStats stats = includeStats ? statsService.getStats() : null;

        return new CardList(cards, stats);
    }

    public List<Review> getCardReviews(String cardId) {
        return flashcardStorage.getCardReviews(cardId);
    }

    private static void validateTags(List<String> tags) {
        if (tags == null) {
            return;
        }

        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new ValidationException("Tags must not be empty");
            }
        }
    }
}
