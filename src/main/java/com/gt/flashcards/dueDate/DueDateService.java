package com.gt.flashcards.dueDate;

import com.gt.flashcards.exception.ValidationException;
import com.gt.flashcards.model.*;
import com.gt.flashcards.storage.FlashcardStorage;
import com.gt.flashcards.util.TagMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class DueDateService {

    private static final Logger log = LoggerFactory.getLogger(DueDateService.class);

    static final String TEST_TAG_PREFIX = "test-";

    private final FlashcardStorage flashcardStorage;
    private final Clock clock;

    @Autowired
    public DueDateService(FlashcardStorage flashcardStorage, Clock clock) {
        this.flashcardStorage = flashcardStorage;
        this.clock = clock;
    }

    public DueDate createDueDate(String topic, String date, String tag) {
        if (topic == null || topic.isBlank() || date == null || date.isBlank()) {
            throw new ValidationException("Missing required parameters for create: topic, date (YYYY-MM-DD)");
        }

        LocalDate dueDay = parseDate(date);
        String dueDateTag = tag == null || tag.isBlank() ? generateTag(topic, date) : tag;

        DueDate dueDate = new DueDate(UUID.randomUUID().toString(), topic, toInstant(dueDay), dueDateTag);
        flashcardStorage.addDueDate(dueDate);
        flashcardStorage.save();

        log.info("Created due date {} for topic '{}' on {} with tag {}", dueDate.id(), topic, date, dueDateTag);
        return dueDate;
    }

    public List<DueDate> listDueDates() {
        return flashcardStorage.listDueDates();
    }

    // Blank fields are left unchanged
    public DueDate updateDueDate(String dueDateId, String topic, String date, String tag) {
        DueDate dueDate = flashcardStorage.getDueDate(dueDateId);

        if (topic != null && !topic.isBlank()) {
            dueDate = dueDate.withTopic(topic);
        }
        if (date != null && !date.isBlank()) {
            dueDate = dueDate.withDueDate(toInstant(parseDate(date)));
        }
        if (tag != null && !tag.isBlank()) {
            dueDate = dueDate.withTag(tag);
        }

        flashcardStorage.updateDueDate(dueDate);
        flashcardStorage.save();

        return dueDate;
    }

    public void deleteDueDate(String dueDateId) {
        flashcardStorage.deleteDueDate(dueDateId);
        flashcardStorage.save();

        log.info("Deleted due date {}", dueDateId);
    }

    /**
     * Progress of the cards carrying the given tag. A card is mastered when its most recent review was
     * rated Easy.
     */
    public TagProgress getTagProgress(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("Missing required parameter: tag");
        }

        return getTagProgress(flashcardStorage.snapshot(), tag);
    }

    /**
     * Progress towards every upcoming due date, earliest first. Due dates that have already passed are
     * left out unless their tag marks them as a practice test.
     */
    public List<DueDateProgress> getDueDateProgress() {
        FlashcardStore snapshot = flashcardStorage.snapshot();
        LocalDate today = LocalDate.now(clock);

        List<DueDateProgress> progressList = new ArrayList<>();
        for (DueDate dueDate : snapshot.getDueDates()) {
            LocalDate dueDay = LocalDate.ofInstant(dueDate.dueDate(), ZoneOffset.UTC);
            String tag = dueDate.tag() == null ? "" : dueDate.tag();

            if (dueDay.isBefore(today) && !tag.startsWith(TEST_TAG_PREFIX)) {
                log.debug("Skipping past due date {} ({})", dueDate.topic(), dueDay);
                continue;
            }

            TagProgress tagProgress = getTagProgress(snapshot, tag);

            // The due day itself is not available for study
            long daysUntilDue = ChronoUnit.DAYS.between(today, dueDay);
            double daysRemaining = Math.max(0, daysUntilDue - 1);

            int cardsLeft = tagProgress.totalCards() - tagProgress.masteredCards();
            double requiredPace = daysRemaining > 0 && cardsLeft > 0 ? cardsLeft / daysRemaining : 0.0;

            progressList.add(new DueDateProgress(dueDate.id(), dueDate.topic(), dueDay.toString(), tag,
                    tagProgress.totalCards(), tagProgress.masteredCards(), tagProgress.progressPercent(),
                    daysRemaining, cardsLeft, requiredPace));
        }

        progressList.sort(Comparator.comparing(DueDateProgress::dueDate));
        return progressList;
    }

    private static TagProgress getTagProgress(FlashcardStore snapshot, String tag) {
        if (tag == null || tag.isEmpty()) {
            return TagProgress.EMPTY;
        }

        List<String> requiredTags = List.of(tag);
        Set<String> cardIds = snapshot.getCards().values()
                .stream()
                .filter(card -> TagMatcher.hasAllTags(card, requiredTags))
                .map(Card::id)
                .collect(Collectors.toSet());
        if (cardIds.isEmpty()) {
            return TagProgress.EMPTY;
        }

        // Latest review per card by timestamp, later log entries win ties
        Map<String, Review> latestReviews = new HashMap<>();
        for (Review review : snapshot.getReviews()) {
            if (cardIds.contains(review.cardId())) {
                latestReviews.merge(review.cardId(), review,
                        (current, candidate) -> candidate.timestamp().isBefore(current.timestamp()) ? current : candidate);
            }
        }

        int masteredCards = (int) latestReviews.values()
                .stream()
                .filter(review -> review.rating() == Rating.Easy)
                .count();

        log.debug("Tag {}: {} of {} cards mastered", tag, masteredCards, cardIds.size());
        return new TagProgress(cardIds.size(), masteredCards, 100.0 * masteredCards / cardIds.size());
    }

    static String generateTag(String topic, String date) {
        return TEST_TAG_PREFIX + topic.replace(" ", "-").toLowerCase(Locale.ROOT) + "-" + date;
    }

    private static LocalDate parseDate(String date) {
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid date format: " + date + ". Use YYYY-MM-DD.", ex);
        }
    }

    private static Instant toInstant(LocalDate dueDay) {
        return dueDay.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
