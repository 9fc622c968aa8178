package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// The whole persisted document. Only accessed while the owning storage holds its lock.
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlashcardStore {

    @JsonProperty("cards")
    private Map<String, Card> cards;

    @JsonProperty("reviews")
    private List<Review> reviews;

    @JsonProperty("due_dates")
    private List<DueDate> dueDates;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    public FlashcardStore() {
        this(new LinkedHashMap<>(), new ArrayList<>(), new ArrayList<>(), null);
    }

    public FlashcardStore(Map<String, Card> cards, List<Review> reviews, List<DueDate> dueDates, Instant lastUpdated) {
        this.cards = cards;
        this.reviews = reviews;
        this.dueDates = dueDates;
        this.lastUpdated = lastUpdated;
    }

    public Map<String, Card> getCards() {
        return cards;
    }

    public List<Review> getReviews() {
        return reviews;
    }

    public List<DueDate> getDueDates() {
        return dueDates;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    // Older files may omit any of the collections
    public FlashcardStore normalize() {
        if (cards == null) {
            cards = new LinkedHashMap<>();
        }
        if (reviews == null) {
            reviews = new ArrayList<>();
        }
        if (dueDates == null) {
            dueDates = new ArrayList<>();
        }

        return this;
    }

    public FlashcardStore copy() {
        return new FlashcardStore(new LinkedHashMap<>(cards), new ArrayList<>(reviews), new ArrayList<>(dueDates), lastUpdated);
    }
}
