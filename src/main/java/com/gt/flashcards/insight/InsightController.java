package com.gt.flashcards.insight;

import com.gt.flashcards.model.LearningAnalysis;
import com.gt.flashcards.model.TagSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/rest")
public class InsightController {

    private final LearningInsightService learningInsightService;

    public InsightController(LearningInsightService learningInsightService) {
        this.learningInsightService = learningInsightService;
    }

    @GetMapping(value = "/tags", produces = "application/json")
    public List<TagSummary> getTags() {
        return learningInsightService.getTagSummaries();
    }

    @GetMapping(value = "/analysis", produces = "application/json")
    public LearningAnalysis analyzeLearning() {
        return learningInsightService.analyzeLearning();
    }
}
