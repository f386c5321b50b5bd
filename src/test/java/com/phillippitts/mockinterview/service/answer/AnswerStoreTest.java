package com.phillippitts.mockinterview.service.answer;

import com.phillippitts.mockinterview.domain.Answer;
import com.phillippitts.mockinterview.domain.AnswerChannel;
import com.phillippitts.mockinterview.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnswerStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void sameTextTwiceLeavesAnswerUntouched() {
        AnswerStore store = new AnswerStore(5);
        assertThat(store.upsert(1, "I led the migration", AnswerChannel.TYPED, T0)).isTrue();

        boolean changed = store.upsert(1, "I led the migration", AnswerChannel.TYPED, T0.plusSeconds(30));

        assertThat(changed).isFalse();
        assertThat(store.get(1)).get().extracting(Answer::lastModified).isEqualTo(T0);
        assertThat(store.snapshot()).hasSize(1);
    }

    @Test
    void voiceTranscriptReplacesTypedText() {
        AnswerStore store = new AnswerStore(5);
        store.upsert(0, "typed draft", AnswerChannel.TYPED, T0);

        store.upsert(0, "spoken answer", AnswerChannel.VOICE, T0.plusSeconds(5));

        Answer answer = store.get(0).orElseThrow();
        assertThat(answer.text()).isEqualTo("spoken answer");
        assertThat(answer.channel()).isEqualTo(AnswerChannel.VOICE);
        assertThat(answer.lastModified()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    void outOfRangeIndexIsRejected() {
        AnswerStore store = new AnswerStore(5);

        assertThatThrownBy(() -> store.upsert(5, "x", AnswerChannel.TYPED, T0))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getField()).isEqualTo("questionIndex"));
        assertThatThrownBy(() -> store.upsert(-1, "x", AnswerChannel.TYPED, T0))
                .isInstanceOf(ValidationException.class);
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void completionCountsOnlyNonBlankAnswers() {
        AnswerStore store = new AnswerStore(4);
        store.upsert(0, "answer", AnswerChannel.TYPED, T0);
        store.upsert(1, "   ", AnswerChannel.TYPED, T0);
        store.recordTimeSpent(2, 40, T0);

        assertThat(store.answeredCount()).isEqualTo(1);
        assertThat(store.completionFraction()).isEqualTo(0.25);
        assertThat(store.isAnswered(1)).isFalse();
        assertThat(store.isAnswered(3)).isFalse();
    }

    @Test
    void timeSpentAccumulatesAcrossVisits() {
        AnswerStore store = new AnswerStore(3);
        store.upsert(0, "answer", AnswerChannel.TYPED, T0);

        store.recordTimeSpent(0, 30, T0);
        store.recordTimeSpent(0, 15, T0);
        store.recordTimeSpent(1, 0, T0);

        assertThat(store.get(0).orElseThrow().timeSpentSeconds()).isEqualTo(45);
        assertThat(store.get(1)).isEmpty();
        assertThat(store.totalTimeSpentSeconds()).isEqualTo(45);
    }

    @Test
    void snapshotIsOrderedByIndex() {
        AnswerStore store = new AnswerStore(5);
        store.upsert(3, "d", AnswerChannel.TYPED, T0);
        store.upsert(0, "a", AnswerChannel.TYPED, T0);
        store.upsert(2, "c", AnswerChannel.VOICE, T0);

        assertThat(store.snapshot()).extracting(Answer::questionIndex).containsExactly(0, 2, 3);
    }

    @Test
    void restoreDropsOutOfRangeEntries() {
        AnswerStore store = new AnswerStore(2);
        store.upsert(0, "stale", AnswerChannel.TYPED, T0);

        store.restore(List.of(
                new Answer(1, "recovered", T0, 20, AnswerChannel.TYPED),
                new Answer(7, "bogus", T0, 0, AnswerChannel.TYPED)));

        assertThat(store.snapshot()).extracting(Answer::text).containsExactly("recovered");
        assertThat(store.questionCount()).isEqualTo(2);
    }
}
