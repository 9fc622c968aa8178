package com.gt.flashcards.exception;

public class CardNotFoundException extends NotFoundException {

    private final String cardId;

    public CardNotFoundException(String cardId) {
        super("Card not found: " + cardId);

        this.cardId = cardId;
    }

    public String getCardId() {
        return cardId;
    }
}
