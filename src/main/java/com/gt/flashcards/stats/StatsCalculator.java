package com.gt.flashcards.stats;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardStats;
import com.gt.flashcards.model.Review;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class StatsCalculator {

    /**
     * Aggregate counts over the given cards. Only reviews of those cards are counted, so orphaned reviews
     * of deleted cards do not contribute. "Today" starts at midnight in the given zone.
     */
    public static CardStats calculateStats(Collection<Card> cards, List<Review> reviews, Instant now, ZoneId zone) {
        Instant startOfToday = now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();

        Set<String> cardIds = new HashSet<>();
        int dueCards = 0;
        for (Card card : cards) {
            cardIds.add(card.id());
            if (card.isDue(now)) {
                dueCards++;
            }
        }

        int reviewsToday = 0;
        int correctReviewsToday = 0;
        for (Review review : reviews) {
            if (cardIds.contains(review.cardId()) && !review.timestamp().isBefore(startOfToday)) {
                reviewsToday++;
                if (review.rating().isCorrect()) {
                    correctReviewsToday++;
                }
            }
        }

        double retentionRate = reviewsToday > 0 ? (double) correctReviewsToday / reviewsToday * 100.0 : 0.0;

        return new CardStats(cards.size(), dueCards, reviewsToday, retentionRate);
    }
}
