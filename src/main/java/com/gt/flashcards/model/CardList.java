package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CardList(@JsonProperty("cards") List<Card> cards,
                       @JsonProperty("stats") @JsonInclude(JsonInclude.Include.NON_NULL) CardStats stats) { }
