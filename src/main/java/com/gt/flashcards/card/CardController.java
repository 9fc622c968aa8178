package com.gt.flashcards.card;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardList;
import com.gt.flashcards.model.Review;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/cards")
public class CardController {

    private final CardService cardService;

    public CardController(CardService cardService) {
        this.cardService = cardService;
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    @ResponseStatus(HttpStatus.CREATED)
    public Card createCard(@RequestBody CreateCardRequest request) {
        return cardService.createCard(request.front, request.back, request.tags, request.hourOffset);
    }

    @GetMapping(value = "/{cardId}", produces = "application/json")
    public Card getCard(@PathVariable("cardId") String cardId) {
        return cardService.getCard(cardId);
    }

    @PatchMapping(value = "/{cardId}", consumes = "application/json", produces = "application/json")
    public Card updateCard(@PathVariable("cardId") String cardId, @RequestBody UpdateCardRequest request) {
        return cardService.updateCard(cardId, request.front, request.back, request.tags);
    }

    @DeleteMapping("/{cardId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteCard(@PathVariable("cardId") String cardId) {
        cardService.deleteCard(cardId);
    }

    @GetMapping(produces = "application/json")
    public CardList listCards(@RequestParam(value = "tags", required = false) List<String> tags,
                              @RequestParam(value = "includeStats", defaultValue = "false") boolean includeStats) {
        return cardService.listCards(tags, includeStats);
    }

    @GetMapping(value = "/{cardId}/reviews", produces = "application/json")
    public List<Review> getCardReviews(@PathVariable("cardId") String cardId) {
        return cardService.getCardReviews(cardId);
    }

    private record CreateCardRequest(String front, String back, List<String> tags, Double hourOffset) { }

    private record UpdateCardRequest(String front, String back, List<String> tags) { }
}
