package com.gt.flashcards.review;

import com.gt.flashcards.exception.NoCardsDueException;
import com.gt.flashcards.exception.NoCardsMatchingTagsException;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardStats;
import com.gt.flashcards.model.DueCard;
import com.gt.flashcards.model.FlashcardStore;
import com.gt.flashcards.stats.StatsCalculator;
import com.gt.flashcards.storage.FlashcardStorage;
import com.gt.flashcards.util.TagMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class DueCardService {

    private static final Logger log = LoggerFactory.getLogger(DueCardService.class);

    private final FlashcardStorage flashcardStorage;
    private final Clock clock;

    @Autowired
    public DueCardService(FlashcardStorage flashcardStorage, Clock clock) {
        this.flashcardStorage = flashcardStorage;
        this.clock = clock;
    }

    public DueCard getDueCard(List<String> filterTags) {
        return getDueCard(filterTags, clock.instant());
    }

    // Stats always cover every card, regardless of the tag filter, and are attached to the errors as well.
    public DueCard getDueCard(List<String> filterTags, Instant now) {
        List<String> requiredTags = filterTags == null ? List.of() : List.copyOf(filterTags);

        FlashcardStore snapshot = flashcardStorage.snapshot();
        Collection<Card> allCards = snapshot.getCards().values();
        CardStats stats = StatsCalculator.calculateStats(allCards, snapshot.getReviews(), now, clock.getZone());

        Collection<Card> candidates = allCards;
        if (!requiredTags.isEmpty()) {
            candidates = allCards.stream().filter(card -> TagMatcher.hasAllTags(card, requiredTags)).toList();

            if (candidates.isEmpty()) {
                log.debug("No cards carry all of the tags {}", requiredTags);
                throw new NoCardsMatchingTagsException(requiredTags, stats);
            }
        }

        Optional<Card> nextCard = DueCardSelector.selectNextCard(candidates, now);
        if (nextCard.isEmpty()) {
            log.debug("No due cards among {} candidates for tags {}", candidates.size(), requiredTags);
            throw new NoCardsDueException(requiredTags, stats);
        }

        return new DueCard(nextCard.get(), stats);
    }
}
