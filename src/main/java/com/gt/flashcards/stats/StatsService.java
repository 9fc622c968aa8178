package com.gt.flashcards.stats;

import com.gt.flashcards.model.CardStats;
import com.gt.flashcards.model.FlashcardStore;
import com.gt.flashcards.storage.FlashcardStorage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class StatsService {

    private final FlashcardStorage flashcardStorage;
    private final Clock clock;

    @Autowired
    public StatsService(FlashcardStorage flashcardStorage, Clock clock) {
        this.flashcardStorage = flashcardStorage;
        this.clock = clock;
    }

    public CardStats getStats() {
        return getStats(flashcardStorage.snapshot());
    }

    public CardStats getStats(FlashcardStore snapshot) {
        return StatsCalculator.calculateStats(snapshot.getCards().values(), snapshot.getReviews(), clock.instant(), clock.getZone());
    }
}
