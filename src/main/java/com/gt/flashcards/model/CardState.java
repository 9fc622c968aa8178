package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashcards.serialization.CardStateSerializer;

@JsonSerialize(using = CardStateSerializer.class, as = Integer.class)
public enum CardState {
    New(0),
    Learning(1),
    Review(2),
    Relearning(3);

    private final int stateId;

    CardState(int stateId) {
        this.stateId = stateId;
    }

    public int getStateId() {
        return stateId;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CardState fromId(int stateId) {
        for (CardState cardState : values()) {
            if (cardState.stateId == stateId) {
                return cardState;
            }
        }

        throw new IllegalArgumentException("Unknown card state " + stateId);
    }
}
