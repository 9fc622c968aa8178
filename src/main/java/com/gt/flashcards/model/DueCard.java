package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DueCard(@JsonProperty("card") Card card,
                      @JsonProperty("stats") CardStats stats) { }
