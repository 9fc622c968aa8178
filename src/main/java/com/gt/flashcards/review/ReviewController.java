package com.gt.flashcards.review;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardStats;
import com.gt.flashcards.model.DueCard;
import com.gt.flashcards.model.Rating;
import com.gt.flashcards.stats.StatsService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest")
public class ReviewController {

    private final DueCardService dueCardService;
    private final ReviewProcessor reviewProcessor;
    private final StatsService statsService;

    public ReviewController(DueCardService dueCardService, ReviewProcessor reviewProcessor, StatsService statsService) {
        this.dueCardService = dueCardService;
        this.reviewProcessor = reviewProcessor;
        this.statsService = statsService;
    }

    @GetMapping(value = "/review/due", produces = "application/json")
    public DueCard getDueCard(@RequestParam(value = "tags", required = false) List<String> tags) {
        return dueCardService.getDueCard(tags);
    }

    @PostMapping(value = "/review", consumes = "application/json", produces = "application/json")
    public Card submitReview(@RequestBody SubmitReviewRequest request) {
        return reviewProcessor.submitReview(request.cardId, request.rating, request.answer);
    }

    @GetMapping(value = "/stats", produces = "application/json")
    public CardStats getStats() {
        return statsService.getStats();
    }

    private record SubmitReviewRequest(String cardId, Rating rating, String answer) { }
}
