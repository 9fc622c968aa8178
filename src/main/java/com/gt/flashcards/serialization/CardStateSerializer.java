package com.gt.flashcards.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.flashcards.model.CardState;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class CardStateSerializer extends JsonSerializer<CardState> {
    @Override
    public void serialize(CardState cardState, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(cardState.getStateId());
    }
}
