package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashcards.exception.ValidationException;
import com.gt.flashcards.serialization.RatingSerializer;

@JsonSerialize(using = RatingSerializer.class, as = Integer.class)
public enum Rating {
    Again(1),
    Hard(2),
    Good(3),
    Easy(4);

    private final int ratingValue;

    Rating(int ratingValue) {
        this.ratingValue = ratingValue;
    }

    public int getRatingValue() {
        return ratingValue;
    }

    // Good and Easy count as a successful recall
    public boolean isCorrect() {
        return ratingValue >= Good.ratingValue;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Rating fromValue(int ratingValue) {
        for (Rating rating : values()) {
            if (rating.ratingValue == ratingValue) {
                return rating;
            }
        }

        throw new ValidationException("Rating must be between 1 and 4, got " + ratingValue);
    }
}
