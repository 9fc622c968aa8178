package com.gt.flashcards.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.flashcards.exception.CardNotFoundException;
import com.gt.flashcards.exception.DueDateNotFoundException;
import com.gt.flashcards.exception.StorageException;
import com.gt.flashcards.model.*;
import com.gt.flashcards.storage.FlashcardStorage;
import com.gt.flashcards.util.TagMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

public class FileFlashcardStorage implements FlashcardStorage {

    private static final Logger log = LoggerFactory.getLogger(FileFlashcardStorage.class);

    static final String TEMP_FILE_SUFFIX = ".tmp";

    private final Path filePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private FlashcardStore store = new FlashcardStore();

    public FileFlashcardStorage(Path filePath, ObjectMapper objectMapper, Clock clock) {
        this.filePath = filePath;
        this.objectMapper = objectMapper;
        this.clock = clock;

        log.info("Creating file storage for {}", filePath);
    }

    @Override
    public Card createCard(String front, String back, List<String> tags) {
        return withWriteLock(() -> {
            Instant now = clock.instant();
            Card card = Card.newCard(UUID.randomUUID().toString(), front, back, tags, now);

            store.getCards().put(card.id(), card);
            store.setLastUpdated(now);

            log.debug("Created card {}", card.id());
            return card;
        });
    }

    @Override
    public Card getCard(String cardId) {
        return withReadLock(() -> requireCard(cardId));
    }

    @Override
    public void updateCard(Card card) {
        withWriteLock(() -> {
            requireCard(card.id());

            store.getCards().put(card.id(), card);
            store.setLastUpdated(clock.instant());
            return null;
        });
    }

    @Override
    public void deleteCard(String cardId) {
        withWriteLock(() -> {
            requireCard(cardId);

            store.getCards().remove(cardId);
            store.setLastUpdated(clock.instant());

            log.debug("Deleted card {}", cardId);
            return null;
        });
    }

    @Override
    public List<Card> listCards(Collection<String> anyOfTags) {
        return withReadLock(() -> store.getCards().values()
                .stream()
                .filter(card -> TagMatcher.hasAnyTag(card, anyOfTags))
                .toList());
    }

    @Override
    public Review addReview(String cardId, Rating rating, String answer) {
        return withWriteLock(() -> {
            SchedulingState state = requireCard(cardId).fsrs();
            Instant now = clock.instant();

            Review review = new Review(UUID.randomUUID().toString(), cardId, rating, now, answer,
                    state.scheduledDays(), state.elapsedDays(), state.state());

            store.getReviews().add(review);
            store.setLastUpdated(now);
            return review;
        });
    }

    @Override
    public void addReview(Review review) {
        withWriteLock(() -> {
            requireCard(review.cardId());

            store.getReviews().add(review);
            store.setLastUpdated(clock.instant());
            return null;
        });
    }

    @Override
    public List<Review> getCardReviews(String cardId) {
        return withReadLock(() -> {
            requireCard(cardId);

            return store.getReviews()
                    .stream()
                    .filter(review -> cardId.equals(review.cardId()))
                    .toList();
        });
    }

    @Override
    public void addDueDate(DueDate dueDate) {
        withWriteLock(() -> {
            store.getDueDates().add(dueDate);
            store.setLastUpdated(clock.instant());

            log.debug("Added due date {} ({}), {} due dates stored", dueDate.id(), dueDate.topic(), store.getDueDates().size());
            return null;
        });
    }

    @Override
    public DueDate getDueDate(String dueDateId) {
        return withReadLock(() -> store.getDueDates()
                .stream()
                .filter(dueDate -> dueDate.id().equals(dueDateId))
                .findFirst()
                .orElseThrow(() -> new DueDateNotFoundException(dueDateId)));
    }

    @Override
    public List<DueDate> listDueDates() {
        return withReadLock(() -> List.copyOf(store.getDueDates()));
    }

    @Override
    public void updateDueDate(DueDate dueDate) {
        withWriteLock(() -> {
            List<DueDate> dueDates = store.getDueDates();
            for (int index = 0; index < dueDates.size(); index++) {
                if (dueDates.get(index).id().equals(dueDate.id())) {
                    dueDates.set(index, dueDate);
                    store.setLastUpdated(clock.instant());
                    return null;
                }
            }

            throw new DueDateNotFoundException(dueDate.id());
        });
    }

    @Override
    public void deleteDueDate(String dueDateId) {
        withWriteLock(() -> {
            if (!store.getDueDates().removeIf(dueDate -> dueDate.id().equals(dueDateId))) {
                throw new DueDateNotFoundException(dueDateId);
            }
            store.setLastUpdated(clock.instant());

            log.debug("Deleted due date {}, {} due dates remaining", dueDateId, store.getDueDates().size());
            return null;
        });
    }

    @Override
    public FlashcardStore snapshot() {
        return withReadLock(() -> store.copy());
    }

    @Override
    public <T> T executeExclusively(Supplier<T> work) {
        return withWriteLock(work);
    }

    @Override
    public void load() {
        withWriteLock(() -> {
            log.info("Loading flashcards from {}", filePath);

            if (!Files.exists(filePath)) {
                log.info("{} not found, initializing empty store", filePath);

                store = new FlashcardStore();
                saveInternal();
                return null;
            }

            byte[] data = readFile();
            if (data.length == 0) {
                log.info("{} is empty, initializing empty store", filePath);

                store = new FlashcardStore();
                return null;
            }

            try {
                store = objectMapper.readValue(data, FlashcardStore.class).normalize();
            } catch (IOException ex) {
                String errMsg = "Failed to unmarshal storage data from " + filePath;

                log.error(errMsg, ex);
                throw new StorageException(errMsg, ex);
            }

            log.info("Loaded {} cards, {} reviews and {} due dates", store.getCards().size(), store.getReviews().size(), store.getDueDates().size());
            return null;
        });
    }

    @Override
    public void save() {
        withWriteLock(() -> {
            saveInternal();
            return null;
        });
    }

    // Caller must hold the write lock. The rename is the commit point: a failure before it leaves the
    // previously saved file untouched.
    private void saveInternal() {
        store.setLastUpdated(clock.instant());

        byte[] data;
        try {
            data = objectMapper.writeValueAsBytes(store);
        } catch (IOException ex) {
            String errMsg = "Failed to marshal storage data";

            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }

        Path tempFile = filePath.resolveSibling(filePath.getFileName() + TEMP_FILE_SUFFIX);
        try {
            Path parentDir = filePath.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.write(tempFile, data);
            moveIntoPlace(tempFile);
        } catch (IOException ex) {
            removeTempFile(tempFile);

            String errMsg = "Failed to write storage file " + filePath;
            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }

        log.debug("Saved {} cards to {}", store.getCards().size(), filePath);
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("Atomic move not supported for {}, falling back to replace", filePath);
            Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void removeTempFile(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException ex) {
            log.warn("Unable to remove temporary file {}", tempFile, ex);
        }
    }

    private byte[] readFile() {
        try {
            return Files.readAllBytes(filePath);
        } catch (IOException ex) {
            String errMsg = "Failed to read storage file " + filePath;

            log.error(errMsg, ex);
            throw new StorageException(errMsg, ex);
        }
    }

    private Card requireCard(String cardId) {
        Card card = cardId == null ? null : store.getCards().get(cardId);
        if (card == null) {
            throw new CardNotFoundException(cardId);
        }

        return card;
    }

    private <T> T withReadLock(Supplier<T> work) {
        return withLock(lock.readLock(), work);
    }

    private <T> T withWriteLock(Supplier<T> work) {
        return withLock(lock.writeLock(), work);
    }

    private static <T> T withLock(Lock heldLock, Supplier<T> work) {
        heldLock.lock();
        try {
            return work.get();
        } finally {
            heldLock.unlock();
        }
    }
}
