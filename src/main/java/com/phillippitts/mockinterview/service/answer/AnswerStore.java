package com.phillippitts.mockinterview.service.answer;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.AnswerChannel;
import com.phillippitts.mockinterview.exception.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Answers of one session keyed by question index.
 *
 * <p>Keys are always in {@code [0, questionCount)}. Writing the same text twice leaves the stored
 * answer untouched, including its timestamp. Typed and voice writes go through the same path, so
 * the most recent write wins regardless of channel.
 *
 * <p>Not thread-safe; the session state machine guards it.
 */
public final class AnswerStore {

    private final int questionCount;
    private final Map<Integer, Answer> answers = new TreeMap<>();

    public AnswerStore(int questionCount) {
        if (questionCount <= 0) {
            throw new IllegalArgumentException("questionCount must be > 0");
        }
        this.questionCount = questionCount;
    }

    /**
     * Inserts or replaces the answer text for a question.
     *
     * @return {@code true} if the stored text changed
     * @throws ValidationException if the index is out of range or the text is null
     */
    public boolean upsert(int index, String text, AnswerChannel channel, Instant at) {
        checkIndex(index);
        if (text == null) {
            throw new ValidationException("answer", "text must not be null");
        }
        Answer existing = answers.get(index);
        if (existing == null) {
            answers.put(index, new Answer(index, text, at, 0, channel));
            return true;
        }
        if (existing.text().equals(text)) {
            return false;
        }
        answers.put(index, existing.withText(text, at, channel));
        return true;
    }

    /**
     * Adds visit time to a question, creating an empty answer if none exists yet.
     */
    public void recordTimeSpent(int index, long seconds, Instant at) {
        checkIndex(index);
        if (seconds <= 0) {
            return;
        }
        Answer existing = answers.get(index);
        if (existing == null) {
            answers.put(index, new Answer(index, "", at, seconds, AnswerChannel.TYPED));
        } else {
            answers.put(index, existing.plusTimeSpent(seconds));
        }
    }

    /** Replaces the contents with answers recovered from the backend. Out-of-range entries are dropped. */
    public void restore(Collection<Answer> recovered) {
        answers.clear();
        for (Answer a : recovered) {
            if (a.questionIndex() < questionCount) {
                answers.put(a.questionIndex(), a);
            }
        }
    }

    public Optional<Answer> get(int index) {
        checkIndex(index);
        return Optional.ofNullable(answers.get(index));
    }

    public boolean isAnswered(int index) {
        Answer a = answers.get(index);
        return a != null && a.isAnswered();
    }

    public int answeredCount() {
        int n = 0;
        for (Answer a : answers.values()) {
            if (a.isAnswered()) {
                n++;
            }
        }
        return n;
    }

    /** Share of questions with a non-blank answer, in {@code [0, 1]}. */
    public double completionFraction() {
        return (double) answeredCount() / questionCount;
    }

    public long totalTimeSpentSeconds() {
        long total = 0;
        for (Answer a : answers.values()) {
            total += a.timeSpentSeconds();
        }
        return total;
    }

    /** Answers ordered by question index. */
    public List<Answer> snapshot() {
        return List.copyOf(new ArrayList<>(answers.values()));
    }

    public int questionCount() {
        return questionCount;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= questionCount) {
            throw new ValidationException("questionIndex",
                    "must be between 0 and " + (questionCount - 1) + ", got " + index);
        }
    }

    @Override
    public String toString() {
        return "AnswerStore{answered=" + answeredCount() + "/" + questionCount + "}";
    }
}
