package com.gt.flashcards.serialization;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.flashcards.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class StoreObjectMapperFactoryTests {

    private static final Instant TEST_NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final ObjectMapper objectMapper = StoreObjectMapperFactory.createStoreObjectMapper();

    @Test
    public void testWriteCard() throws Exception {
        Card card = Card.newCard("card-1", "front", "back", List.of(), TEST_NOW);

        JsonNode cardNode = objectMapper.readTree(objectMapper.writeValueAsString(card));

        assertEquals("card-1", cardNode.get("id").asText());
        assertEquals("2026-03-10T12:00:00Z", cardNode.get("created_at").asText());
        assertFalse(cardNode.has("tags"));
        assertFalse(cardNode.has("last_reviewed_at"));

        JsonNode fsrsNode = cardNode.get("fsrs");
        assertTrue(fsrsNode.get("State").isInt());
        assertEquals(0, fsrsNode.get("State").asInt());
        assertEquals("2026-03-10T12:00:00Z", fsrsNode.get("Due").asText());
        assertTrue(fsrsNode.has("ScheduledDays"));
        assertFalse(fsrsNode.has("LastReview"));
    }

    @Test
    public void testWriteReviewedCard() throws Exception {
        SchedulingState state = new SchedulingState(TEST_NOW.plus(Duration.ofDays(3)), 3.2, 5.1, 1, 3, 2, 0, CardState.Review, TEST_NOW);
        Card card = Card.newCard("card-1", "front", "back", List.of("tag"), TEST_NOW).withReview(state, TEST_NOW);

        JsonNode cardNode = objectMapper.readTree(objectMapper.writeValueAsString(card));

        assertEquals("tag", cardNode.get("tags").get(0).asText());
        assertEquals("2026-03-10T12:00:00Z", cardNode.get("last_reviewed_at").asText());
        assertEquals(2, cardNode.get("fsrs").get("State").asInt());
        assertEquals(2, cardNode.get("fsrs").get("Reps").asInt());
    }

    @Test
    public void testWriteReview() throws Exception {
        Review review = new Review("review-1", "card-1", Rating.Easy, TEST_NOW, "", 6, 0, CardState.Review);

        JsonNode reviewNode = objectMapper.readTree(objectMapper.writeValueAsString(review));

        assertEquals(4, reviewNode.get("rating").asInt());
        assertEquals("card-1", reviewNode.get("card_id").asText());
        assertEquals(6, reviewNode.get("scheduled_days").asInt());
        assertFalse(reviewNode.has("answer"));
    }

    @Test
    public void testReadStore() throws Exception {
        String json = """
                {
                  "cards": {
                    "card-1": {
                      "id": "card-1",
                      "front": "front",
                      "back": "back",
                      "created_at": "2026-03-01T08:00:00Z",
                      "fsrs": {"Due": "2026-03-05T08:00:00Z", "Stability": 2.4, "Difficulty": 4.93, "ElapsedDays": 0,
                               "ScheduledDays": 0, "Reps": 1, "Lapses": 0, "State": 1, "LastReview": "2026-03-01T08:00:00Z"}
                    }
                  },
                  "reviews": [
                    {"id": "review-1", "card_id": "card-1", "rating": 3, "timestamp": "2026-03-01T08:00:00Z",
                     "scheduled_days": 0, "elapsed_days": 0, "state": 1}
                  ],
                  "last_updated": "2026-03-01T08:00:00Z"
                }
                """;

        FlashcardStore store = objectMapper.readValue(json, FlashcardStore.class).normalize();

        Card card = store.getCards().get("card-1");
        assertEquals(List.of(), card.tags());
        assertNull(card.lastReviewedAt());
        assertEquals(CardState.Learning, card.fsrs().state());
        assertEquals(Instant.parse("2026-03-05T08:00:00Z"), card.fsrs().due());
        assertEquals(Rating.Good, store.getReviews().get(0).rating());
        assertEquals("", store.getReviews().get(0).answer());
        assertTrue(store.getDueDates().isEmpty());
    }

    @Test
    public void testReadInvalidRating() {
        String json = "{\"id\": \"review-1\", \"card_id\": \"card-1\", \"rating\": 5, \"timestamp\": \"2026-03-01T08:00:00Z\", \"state\": 0}";

        assertThrows(JsonMappingException.class, () -> objectMapper.readValue(json, Review.class));
    }
}
