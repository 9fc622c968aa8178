package com.gt.flashcards.dueDate;

import com.gt.flashcards.model.DueDate;
import com.gt.flashcards.model.DueDateProgress;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/dueDates")
public class DueDateController {

    private final DueDateService dueDateService;

    public DueDateController(DueDateService dueDateService) {
        this.dueDateService = dueDateService;
    }

    @GetMapping(produces = "application/json")
    public List<DueDate> listDueDates() {
        return dueDateService.listDueDates();
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    @ResponseStatus(HttpStatus.CREATED)
    public DueDate createDueDate(@RequestBody DueDateRequest request) {
        return dueDateService.createDueDate(request.topic, request.date, request.tag);
    }

    @PatchMapping(value = "/{dueDateId}", consumes = "application/json", produces = "application/json")
    public DueDate updateDueDate(@PathVariable("dueDateId") String dueDateId, @RequestBody DueDateRequest request) {
        return dueDateService.updateDueDate(dueDateId, request.topic, request.date, request.tag);
    }

    @DeleteMapping("/{dueDateId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteDueDate(@PathVariable("dueDateId") String dueDateId) {
        dueDateService.deleteDueDate(dueDateId);
    }

    @GetMapping(value = "/progress", produces = "application/json")
    public List<DueDateProgress> getDueDateProgress() {
        return dueDateService.getDueDateProgress();
    }

    private record DueDateRequest(String topic, String date, String tag) { }
}
