package com.gt.flashcards;

import com.gt.flashcards.card.CardService;
import com.gt.flashcards.dueDate.DueDateService;
import com.gt.flashcards.exception.CardNotFoundException;
import com.gt.flashcards.exception.NoCardsDueException;
import com.gt.flashcards.model.*;
import com.gt.flashcards.review.DueCardService;
import com.gt.flashcards.review.ReviewProcessor;
import com.gt.flashcards.scheduling.impl.FsrsSchedulingOracle;
import com.gt.flashcards.serialization.StoreObjectMapperFactory;
import com.gt.flashcards.stats.StatsService;
import com.gt.flashcards.storage.impl.FileFlashcardStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

// End to end flows over the file store and the default scheduler
@ExtendWith(SpringExtension.class)
public class FlashcardScenarioTests {

    private static final Instant TEST_NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final Clock TEST_CLOCK = Clock.fixed(TEST_NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private FileFlashcardStorage flashcardStorage;
    private CardService cardService;
    private DueCardService dueCardService;
    private ReviewProcessor reviewProcessor;
    private DueDateService dueDateService;
    private StatsService statsService;

    @BeforeEach
    public void setup() {
        flashcardStorage = new FileFlashcardStorage(tempDir.resolve("flashcards.json"), StoreObjectMapperFactory.createStoreObjectMapper(), TEST_CLOCK);
        flashcardStorage.load();

        statsService = new StatsService(flashcardStorage, TEST_CLOCK);
        cardService = new CardService(flashcardStorage, statsService, TEST_CLOCK);
        dueCardService = new DueCardService(flashcardStorage, TEST_CLOCK);
        reviewProcessor = new ReviewProcessor(flashcardStorage, new FsrsSchedulingOracle(0.9, 36500), TEST_CLOCK);
        dueDateService = new DueDateService(flashcardStorage, TEST_CLOCK);
    }

    @Test
    public void testOverdueCardReviewedFirst() {
        Card cardA = cardService.createCard("A", "a", List.of(), -1.0);
        Card cardB = cardService.createCard("B", "b", List.of(), -0.5);

        DueCard firstDue = dueCardService.getDueCard(List.of());
        assertEquals(cardA.id(), firstDue.card().id());
        assertEquals(new CardStats(2, 2, 0, 0.0), firstDue.stats());

        Card reviewedA = reviewProcessor.submitReview(cardA.id(), Rating.Good, "a");
        assertEquals(CardState.Learning, reviewedA.fsrs().state());
        assertEquals(TEST_NOW.plus(Duration.ofMinutes(10)), reviewedA.fsrs().due());

        DueCard secondDue = dueCardService.getDueCard(List.of());
        assertEquals(cardB.id(), secondDue.card().id());
        assertEquals(new CardStats(2, 1, 1, 100.0), secondDue.stats());
    }

    @Test
    public void testNoCardsDueAfterEasyReview() {
        Card card = cardService.createCard("front", "back", List.of("math"));

        Card reviewedCard = reviewProcessor.submitReview(card.id(), Rating.Easy, "back");
        assertEquals(CardState.Review, reviewedCard.fsrs().state());
        assertEquals(TEST_NOW.plus(Duration.ofDays(6)), reviewedCard.fsrs().due());

        NoCardsDueException ex = assertThrows(NoCardsDueException.class, () -> dueCardService.getDueCard(List.of("math")));
        assertTrue(ex.isTagFiltered());
        assertEquals(new CardStats(1, 0, 1, 100.0), ex.getStats());
    }

    @Test
    public void testDueDateMasteryProgress() {
        Card bio1 = cardService.createCard("What is a cell?", "Basic unit of life", List.of("bio"));
        cardService.createCard("What is DNA?", "Genetic material", List.of("bio"));
        cardService.createCard("What is ATP?", "Energy currency", List.of("bio"));
        dueDateService.createDueDate("Biology", "2026-03-20", "bio");

        reviewProcessor.submitReview(bio1.id(), Rating.Easy, "");

        List<DueDateProgress> progressList = dueDateService.getDueDateProgress();
        assertEquals(1, progressList.size());
        assertEquals(3, progressList.get(0).totalCards());
        assertEquals(1, progressList.get(0).masteredCards());
        assertEquals(33.33, progressList.get(0).progressPercent(), 0.01);
        assertEquals(2, progressList.get(0).cardsLeft());
    }

    @Test
    public void testDeletedCardReviewsUnreachable() {
        Card card = cardService.createCard("front", "back", List.of());
        reviewProcessor.submitReview(card.id(), Rating.Again, "");
        reviewProcessor.submitReview(card.id(), Rating.Good, "");
        assertEquals(2, cardService.getCardReviews(card.id()).size());

        cardService.deleteCard(card.id());

        assertThrows(CardNotFoundException.class, () -> cardService.getCardReviews(card.id()));
        assertThrows(CardNotFoundException.class, () -> reviewProcessor.submitReview(card.id(), Rating.Good, ""));
        assertEquals(CardStats.EMPTY, statsService.getStats());
    }

    @Test
    public void testStateSurvivesRestart() {
        Card card = cardService.createCard("front", "back", List.of("persisted"));
        Card reviewedCard = reviewProcessor.submitReview(card.id(), Rating.Hard, "answer");
        DueDate dueDate = dueDateService.createDueDate("Exam", "2026-04-01", "persisted");

        FileFlashcardStorage restartedStorage = new FileFlashcardStorage(tempDir.resolve("flashcards.json"), StoreObjectMapperFactory.createStoreObjectMapper(), TEST_CLOCK);
        restartedStorage.load();

        assertEquals(reviewedCard, restartedStorage.getCard(card.id()));
        assertEquals(1, restartedStorage.getCardReviews(card.id()).size());
        assertEquals(List.of(dueDate), restartedStorage.listDueDates());
    }
}
