package com.gt.flashcards.insight;

import com.gt.flashcards.model.*;
import com.gt.flashcards.stats.StatsService;
import com.gt.flashcards.storage.FlashcardStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

@Component
public class LearningInsightService {

    private static final Logger log = LoggerFactory.getLogger(LearningInsightService.class);

    private final FlashcardStorage flashcardStorage;
    private final StatsService statsService;
    private final Clock clock;
    private final double lowScoreThreshold;
    private final int maxLowScoringCards;

    @Autowired
    public LearningInsightService(FlashcardStorage flashcardStorage,
                                  StatsService statsService,
                                  Clock clock,
                                  @Value("${flashcards.analysis.lowScoreThreshold:2.5}") double lowScoreThreshold,
                                  @Value("${flashcards.analysis.maxLowScoringCards:10}") int maxLowScoringCards) {
        this.flashcardStorage = flashcardStorage;
        this.statsService = statsService;
        this.clock = clock;
        this.lowScoreThreshold = lowScoreThreshold;
        this.maxLowScoringCards = maxLowScoringCards;
    }

    public List<TagSummary> getTagSummaries() {
        FlashcardStore snapshot = flashcardStorage.snapshot();
        Instant now = clock.instant();

        Map<String, Integer> cardCounts = new TreeMap<>();
        Map<String, Integer> dueCounts = new HashMap<>();
        int dueCards = 0;

        for (Card card : snapshot.getCards().values()) {
            boolean due = card.isDue(now);
            if (due) {
                dueCards++;
            }

            for (String tag : card.tags()) {
                cardCounts.merge(tag, 1, Integer::sum);
                if (due) {
                    dueCounts.merge(tag, 1, Integer::sum);
                }
            }
        }

        int totalCards = snapshot.getCards().size();
        List<TagSummary> tagSummaries = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : cardCounts.entrySet()) {
            tagSummaries.add(new TagSummary(entry.getKey(), entry.getValue(), dueCounts.getOrDefault(entry.getKey(), 0), totalCards, dueCards));
        }

        return tagSummaries;
    }

    /**
     * Finds the cards the learner struggles with most: reviewed cards whose average rating is at or
     * below the low score threshold, lowest average first. Common tags are the tags shared by more than
     * one of those cards, most frequent first.
     */
    public LearningAnalysis analyzeLearning() {
        FlashcardStore snapshot = flashcardStorage.snapshot();
        CardStats stats = statsService.getStats(snapshot);

        Map<String, List<Review>> reviewsByCard = new HashMap<>();
        for (Review review : snapshot.getReviews()) {
            reviewsByCard.computeIfAbsent(review.cardId(), cardId -> new ArrayList<>()).add(review);
        }

        int totalReviews = 0;
        List<LearningAnalysis.CardAnalysis> analyzedCards = new ArrayList<>();
        for (Card card : snapshot.getCards().values()) {
            List<Review> cardReviews = reviewsByCard.getOrDefault(card.id(), List.of());
            if (cardReviews.isEmpty()) {
                continue;
            }

            int ratingSum = 0;
            for (Review review : cardReviews) {
                ratingSum += review.rating().getRatingValue();
            }
            totalReviews += cardReviews.size();

            analyzedCards.add(new LearningAnalysis.CardAnalysis(card, List.copyOf(cardReviews),
                    (double) ratingSum / cardReviews.size(), cardReviews.size()));
        }

        List<LearningAnalysis.CardAnalysis> lowScoringCards = analyzedCards.stream()
                .filter(analysis -> analysis.avgRating() <= lowScoreThreshold)
                .sorted(Comparator.comparingDouble(LearningAnalysis.CardAnalysis::avgRating))
                .limit(maxLowScoringCards)
                .toList();

        log.debug("{} of {} reviewed cards are low scoring", lowScoringCards.size(), analyzedCards.size());

        return new LearningAnalysis(lowScoringCards, getCommonTags(lowScoringCards), totalReviews, stats);
    }

    private static List<String> getCommonTags(List<LearningAnalysis.CardAnalysis> lowScoringCards) {
        Map<String, Integer> tagFrequency = new TreeMap<>();
        for (LearningAnalysis.CardAnalysis analysis : lowScoringCards) {
            for (String tag : analysis.card().tags()) {
                tagFrequency.merge(tag, 1, Integer::sum);
            }
        }

        // Stable sort keeps equally frequent tags in name order
        return tagFrequency.entrySet()
                .stream()
                .filter(entry -> entry.getValue() > 1)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .map(Map.Entry::getKey)
                .toList();
    }
}
