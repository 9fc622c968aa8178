package com.gt.flashcards.exception;

public class DueDateNotFoundException extends NotFoundException {

    private final String dueDateId;

    public DueDateNotFoundException(String dueDateId) {
        super("Due date with ID " + dueDateId + " not found");

        this.dueDateId = dueDateId;
    }

    public String getDueDateId() {
        return dueDateId;
    }
}
