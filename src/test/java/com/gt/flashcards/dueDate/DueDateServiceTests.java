package com.gt.flashcards.dueDate;

import com.gt.flashcards.exception.DueDateNotFoundException;
import com.gt.flashcards.exception.ValidationException;
import com.gt.flashcards.model.*;
import com.gt.flashcards.serialization.StoreObjectMapperFactory;
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
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class DueDateServiceTests {

    private static final Instant TEST_NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final Clock TEST_CLOCK = Clock.fixed(TEST_NOW, ZoneOffset.UTC);
    private static final double DELTA = 0.01;

    @TempDir
    Path tempDir;

    private Path storageFile;
    private FileFlashcardStorage flashcardStorage;
    private DueDateService dueDateService;

    @BeforeEach
    public void setup() {
        storageFile = tempDir.resolve("flashcards.json");
        flashcardStorage = new FileFlashcardStorage(storageFile, StoreObjectMapperFactory.createStoreObjectMapper(), TEST_CLOCK);
        dueDateService = new DueDateService(flashcardStorage, TEST_CLOCK);
    }

    @Test
    public void testCreateDueDate_GeneratesTag() {
        DueDate dueDate = dueDateService.createDueDate("Biology Exam", "2026-04-01", null);

        assertEquals("Biology Exam", dueDate.topic());
        assertEquals(Instant.parse("2026-04-01T00:00:00Z"), dueDate.dueDate());
        assertEquals("test-biology-exam-2026-04-01", dueDate.tag());
        assertEquals(List.of(dueDate), dueDateService.listDueDates());
    }

    @Test
    public void testCreateDueDate_KeepsGivenTag() {
        DueDate dueDate = dueDateService.createDueDate("Biology Exam", "2026-04-01", "bio");

        assertEquals("bio", dueDate.tag());
    }

    @Test
    public void testCreateDueDate_Persists() {
        DueDate dueDate = dueDateService.createDueDate("Chemistry", "2026-05-15", "chem");

        FileFlashcardStorage reloadedStorage = new FileFlashcardStorage(storageFile, StoreObjectMapperFactory.createStoreObjectMapper(), TEST_CLOCK);
        reloadedStorage.load();

        assertEquals(dueDate, reloadedStorage.getDueDate(dueDate.id()));
    }

    @Test
    public void testCreateDueDate_Validation() {
        assertThrows(ValidationException.class, () -> dueDateService.createDueDate("", "2026-04-01", null));
        assertThrows(ValidationException.class, () -> dueDateService.createDueDate("Exam", null, null));

        ValidationException ex = assertThrows(ValidationException.class, () -> dueDateService.createDueDate("Exam", "04/01/2026", null));
        assertEquals("Invalid date format: 04/01/2026. Use YYYY-MM-DD.", ex.getMessage());

        assertTrue(dueDateService.listDueDates().isEmpty());
    }

    @Test
    public void testGenerateTag() {
        assertEquals("test-us-history-2026-06-01", DueDateService.generateTag("US History", "2026-06-01"));
    }

    @Test
    public void testUpdateDueDate() {
        DueDate dueDate = dueDateService.createDueDate("Biology Exam", "2026-04-01", "bio");

        DueDate updatedDueDate = dueDateService.updateDueDate(dueDate.id(), null, "2026-04-03", "");

        assertEquals("Biology Exam", updatedDueDate.topic());
        assertEquals(Instant.parse("2026-04-03T00:00:00Z"), updatedDueDate.dueDate());
        assertEquals("bio", updatedDueDate.tag());
        assertEquals(updatedDueDate, flashcardStorage.getDueDate(dueDate.id()));
    }

    @Test
    public void testUpdateDueDate_InvalidDate() {
        DueDate dueDate = dueDateService.createDueDate("Biology Exam", "2026-04-01", "bio");

        assertThrows(ValidationException.class, () -> dueDateService.updateDueDate(dueDate.id(), "New topic", "2026-13-01", null));
        assertEquals(dueDate, flashcardStorage.getDueDate(dueDate.id()));
    }

    @Test
    public void testUpdateAndDeleteDueDate_NotFound() {
        assertThrows(DueDateNotFoundException.class, () -> dueDateService.updateDueDate("missing", "topic", null, null));
        assertThrows(DueDateNotFoundException.class, () -> dueDateService.deleteDueDate("missing"));
    }

    @Test
    public void testDeleteDueDate() {
        DueDate dueDate = dueDateService.createDueDate("Biology Exam", "2026-04-01", "bio");

        dueDateService.deleteDueDate(dueDate.id());

        assertTrue(dueDateService.listDueDates().isEmpty());
    }

    @Test
    public void testGetTagProgress() {
        Card masteredCard = flashcardStorage.createCard("q1", "a1", List.of("bio"));
        Card relapsedCard = flashcardStorage.createCard("q2", "a2", List.of("bio"));
        flashcardStorage.createCard("q3", "a3", List.of("bio", "cells"));
        flashcardStorage.createCard("q4", "a4", List.of("chem"));

        addReview(masteredCard.id(), Rating.Again, TEST_NOW.minus(Duration.ofDays(2)));
        addReview(masteredCard.id(), Rating.Easy, TEST_NOW.minus(Duration.ofDays(1)));
        addReview(relapsedCard.id(), Rating.Easy, TEST_NOW.minus(Duration.ofDays(2)));
        addReview(relapsedCard.id(), Rating.Hard, TEST_NOW.minus(Duration.ofDays(1)));

        TagProgress tagProgress = dueDateService.getTagProgress("bio");

        assertEquals(3, tagProgress.totalCards());
        assertEquals(1, tagProgress.masteredCards());
        assertEquals(33.33, tagProgress.progressPercent(), DELTA);
    }

    @Test
    public void testGetTagProgress_NoCards() {
        assertEquals(TagProgress.EMPTY, dueDateService.getTagProgress("nothing"));
    }

    @Test
    public void testGetTagProgress_MissingTag() {
        assertThrows(ValidationException.class, () -> dueDateService.getTagProgress(""));
        assertThrows(ValidationException.class, () -> dueDateService.getTagProgress(null));
    }

    @Test
    public void testGetDueDateProgress() {
        Card card1 = flashcardStorage.createCard("q1", "a1", List.of("bio"));
        flashcardStorage.createCard("q2", "a2", List.of("bio"));
        flashcardStorage.createCard("q3", "a3", List.of("bio"));
        addReview(card1.id(), Rating.Easy, TEST_NOW.minus(Duration.ofHours(1)));

        DueDate bioExam = dueDateService.createDueDate("Biology", "2026-03-20", "bio");

        List<DueDateProgress> progressList = dueDateService.getDueDateProgress();

        assertEquals(1, progressList.size());
        DueDateProgress progress = progressList.get(0);
        assertEquals(bioExam.id(), progress.id());
        assertEquals("2026-03-20", progress.dueDate());
        assertEquals(3, progress.totalCards());
        assertEquals(1, progress.masteredCards());
        assertEquals(33.33, progress.progressPercent(), DELTA);
        assertEquals(9.0, progress.daysRemaining(), DELTA);
        assertEquals(2, progress.cardsLeft());
        assertEquals(2.0 / 9.0, progress.requiredPace(), 1e-9);
    }

    @Test
    public void testGetDueDateProgress_PastDates() {
        dueDateService.createDueDate("Old exam", "2026-03-01", "old-exam");
        dueDateService.createDueDate("Practice test", "2026-03-02", null);
        dueDateService.createDueDate("Today", "2026-03-10", "today");
        dueDateService.createDueDate("Tomorrow", "2026-03-11", "tomorrow");

        List<DueDateProgress> progressList = dueDateService.getDueDateProgress();

        assertEquals(List.of("Practice test", "Today", "Tomorrow"), progressList.stream().map(DueDateProgress::topic).toList());
        for (DueDateProgress progress : progressList) {
            assertEquals(0.0, progress.daysRemaining(), DELTA);
            assertEquals(0.0, progress.requiredPace(), DELTA);
            assertEquals(0, progress.totalCards());
            assertEquals(0.0, progress.progressPercent(), DELTA);
        }
    }

    @Test
    public void testGetDueDateProgress_SortedByDate() {
        dueDateService.createDueDate("Later", "2026-06-01", "later");
        dueDateService.createDueDate("Sooner", "2026-04-01", "sooner");

        List<DueDateProgress> progressList = dueDateService.getDueDateProgress();

        assertEquals(List.of("Sooner", "Later"), progressList.stream().map(DueDateProgress::topic).toList());
        assertEquals(21.0, progressList.get(0).daysRemaining(), DELTA);
    }

    private void addReview(String cardId, Rating rating, Instant timestamp) {
        flashcardStorage.addReview(new Review(UUID.randomUUID().toString(), cardId, rating, timestamp, "", 0, 0, CardState.Review));
    }
}
