package com.gt.flashcards.storage;

import com.gt.flashcards.model.*;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Persisted flashcard store. Mutations are only held in memory until {@link #save()} is called; callers
 * are expected to save after each batch of mutations.
 */
public interface FlashcardStorage {

    Card createCard(String front, String back, List<String> tags);

    Card getCard(String cardId);

    void updateCard(Card card);

    void deleteCard(String cardId);

    /**
     * Lists cards carrying ANY of the given tags. A null or empty filter returns every card.
     */
    List<Card> listCards(Collection<String> anyOfTags);

    /**
     * Appends a review that snapshots the card's current scheduling state.
     */
    Review addReview(String cardId, Rating rating, String answer);

    void addReview(Review review);

    /**
     * Reviews of an existing card, in log order. Reviews of a deleted card stay in the log but are no
     * longer reachable through this call.
     */
    List<Review> getCardReviews(String cardId);

    void addDueDate(DueDate dueDate);

    DueDate getDueDate(String dueDateId);

    List<DueDate> listDueDates();

    void updateDueDate(DueDate dueDate);

    void deleteDueDate(String dueDateId);

    /**
     * Consistent copy of the whole store, taken under shared access.
     */
    FlashcardStore snapshot();

    /**
     * Runs the given work while holding exclusive access. Calls back into this storage from the work
     * re-enter the same lock.
     */
    <T> T executeExclusively(Supplier<T> work);

    void load();

    void save();
}
