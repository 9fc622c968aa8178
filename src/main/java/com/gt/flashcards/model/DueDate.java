package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DueDate(@JsonProperty("id") String id,
                      @JsonProperty("topic") String topic,
                      @JsonProperty("due_date") Instant dueDate,
                      @JsonProperty("tag") String tag) {

    public DueDate withTopic(String newTopic) {
        return new DueDate(id, newTopic, dueDate, tag);
    }

    public DueDate withDueDate(Instant newDueDate) {
        return new DueDate(id, topic, newDueDate, tag);
    }

    public DueDate withTag(String newTag) {
        return new DueDate(id, topic, dueDate, newTag);
    }
}
