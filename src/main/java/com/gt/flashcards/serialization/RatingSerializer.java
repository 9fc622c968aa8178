package com.gt.flashcards.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.flashcards.model.Rating;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RatingSerializer extends JsonSerializer<Rating> {
    @Override
    public void serialize(Rating rating, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeNumber(rating.getRatingValue());
    }
}
