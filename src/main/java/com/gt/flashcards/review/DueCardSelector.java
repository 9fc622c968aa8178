package com.gt.flashcards.review;

import com.gt.flashcards.model.Card;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

public class DueCardSelector {

    private static final Logger log = LoggerFactory.getLogger(DueCardSelector.class);

    /**
     * Picks the due card with the highest review priority. Equal priorities are resolved by the
     * lexicographically smallest card id so the choice is stable between calls.
     */
    public static Optional<Card> selectNextCard(Collection<Card> candidates, Instant now) {
        Optional<PrioritizedCard> selected = candidates.stream()
                .filter(card -> card.isDue(now))
                .map(card -> new PrioritizedCard(card, ReviewPriorityCalculator.getReviewPriority(card.fsrs().state(), card.fsrs().due(), now)))
                .min(Comparator.comparingDouble(PrioritizedCard::priority).reversed()
                        .thenComparing(prioritizedCard -> prioritizedCard.card().id()));

        selected.ifPresent(prioritizedCard -> log.debug("Selected card {} with priority {}", prioritizedCard.card().id(), prioritizedCard.priority()));

        return selected.map(PrioritizedCard::card);
    }

    private record PrioritizedCard(Card card, double priority) { }
}
