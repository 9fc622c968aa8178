package com.gt.flashcards.util;

import com.gt.flashcards.model.Card;

import java.util.Collection;

// Tag matching is exact and case-sensitive. Listing uses ANY-of semantics, due card selection and
// progress use ALL-of semantics; the two are kept as separate operations.
public class TagMatcher {

    public static boolean hasAnyTag(Card card, Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return true;
        }

        for (String tag : tags) {
            if (card.tags().contains(tag)) {
                return true;
            }
        }

        return false;
    }

    public static boolean hasAllTags(Card card, Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return true;
        }

        return card.tags().containsAll(tags);
    }
}
