package com.phillippitts.mockinterview.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InterviewConfigTest {

    @Test
    void acceptsBoundaryValues() {
        InterviewConfig low = new InterviewConfig(5, 1, InterviewType.BEHAVIORAL, ExperienceLevel.ENTRY);
        InterviewConfig high = new InterviewConfig(20, 5, InterviewType.TECHNICAL, ExperienceLevel.SENIOR);

        assertThat(low.timeLimitSeconds()).isEqualTo(60);
        assertThat(high.timeLimitSeconds()).isEqualTo(300);
    }

    @Test
    void rejectsQuestionCountOutsideRange() {
        assertThatThrownBy(() -> new InterviewConfig(4, 2, InterviewType.MIXED, ExperienceLevel.MID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("questionCount");
        assertThatThrownBy(() -> new InterviewConfig(21, 2, InterviewType.MIXED, ExperienceLevel.MID))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMinutesOutsideRange() {
        assertThatThrownBy(() -> new InterviewConfig(10, 0, InterviewType.MIXED, ExperienceLevel.MID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timePerQuestionMinutes");
        assertThatThrownBy(() -> new InterviewConfig(10, 6, InterviewType.MIXED, ExperienceLevel.MID))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesTypeAndLevelCaseInsensitively() {
        assertThat(InterviewType.parse("Behavioral")).isEqualTo(InterviewType.BEHAVIORAL);
        assertThat(InterviewType.parse("  technical ")).isEqualTo(InterviewType.TECHNICAL);
        assertThat(InterviewType.parse("panel")).isNull();
        assertThat(ExperienceLevel.parse("SENIOR")).isEqualTo(ExperienceLevel.SENIOR);
        assertThat(ExperienceLevel.parse("")).isNull();
        assertThat(InterviewType.MIXED.wireValue()).isEqualTo("mixed");
    }
}
