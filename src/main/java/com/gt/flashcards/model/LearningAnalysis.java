package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LearningAnalysis(@JsonProperty("low_scoring_cards") List<CardAnalysis> lowScoringCards,
                               @JsonProperty("common_tags") List<String> commonTags,
                               @JsonProperty("total_reviews") int totalReviews,
                               @JsonProperty("stats") CardStats stats) {

    public record CardAnalysis(@JsonProperty("card") Card card,
                               @JsonProperty("reviews") List<Review> reviews,
                               @JsonProperty("avg_rating") double avgRating,
                               @JsonProperty("review_count") int reviewCount) { }
}
