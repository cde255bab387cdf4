package com.openforge.tutor.mastery;

import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.LessonProgress;
import com.openforge.tutor.repository.LessonProgressRepository;
import com.openforge.tutor.testutil.Fixtures;
import com.openforge.tutor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.openforge.tutor.domain.EvidenceType.CORRECT_ANSWER;
import static com.openforge.tutor.domain.EvidenceType.EXPLANATION;
import static com.openforge.tutor.domain.EvidenceType.INCORRECT_ANSWER;
import static com.openforge.tutor.domain.EvidenceType.STRUGGLE;
import static com.openforge.tutor.testutil.Fixtures.LESSON;
import static com.openforge.tutor.testutil.Fixtures.USER;
import static com.openforge.tutor.testutil.Fixtures.evidence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MasteryCalculatorTest {

    private final EvidenceStore store = mock(EvidenceStore.class);
    private final LessonProgressRepository progress = mock(LessonProgressRepository.class);
    private final MutableClock clock = MutableClock.at("2026-01-01T10:00:00Z");
    private MasteryCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new MasteryCalculator(store, progress, Fixtures.cacheProperties(), clock);
        when(progress.findFirstByUserIdAndLessonIdOrderByCreateTimeDesc(USER, LESSON)).thenReturn(Optional.empty());
    }

    @Test
    void answerRatioWinsOverQuality() {
        when(store.forLesson(USER, LESSON)).thenReturn(List.of(
                evidence(CORRECT_ANSWER, 90),
                evidence(CORRECT_ANSWER, 90),
                evidence(INCORRECT_ANSWER, 10),
                evidence(EXPLANATION, 20)));

        assertThat(calculator.computeMastery(USER, LESSON)).isEqualTo(67);
    }

    @Test
    void averagesNonZeroQualityWhenNoAnswers() {
        when(store.forLesson(USER, LESSON)).thenReturn(List.of(
                evidence(EXPLANATION, 80),
                evidence(STRUGGLE, 0),
                evidence(EXPLANATION, null),
                evidence(EXPLANATION, 65)));

        assertThat(calculator.computeMastery(USER, LESSON)).isEqualTo(73);
    }

    @Test
    void fallsBackToStoredProgress() {
        when(store.forLesson(USER, LESSON)).thenReturn(List.of());
        LessonProgress row = new LessonProgress();
        row.setMasteryLevel(42);
        when(progress.findFirstByUserIdAndLessonIdOrderByCreateTimeDesc(USER, LESSON)).thenReturn(Optional.of(row));

        assertThat(calculator.computeMastery(USER, LESSON)).isEqualTo(42);
    }

    @Test
    void neutralWithoutAnyData() {
        when(store.forLesson(USER, LESSON)).thenReturn(List.of(evidence(STRUGGLE, 0)));

        assertThat(calculator.computeMastery(USER, LESSON)).isEqualTo(MasteryCalculator.NEUTRAL_MASTERY);
    }

    @Test
    void neutralWhenStoreFails() {
        when(store.forLesson(USER, LESSON)).thenThrow(new IllegalStateException("db down"));

        assertThat(calculator.computeMastery(USER, LESSON)).isEqualTo(50);
    }

    @Test
    void cachesUntilTtlExpires() {
        when(store.forLesson(USER, LESSON)).thenReturn(List.of(evidence(CORRECT_ANSWER, 90)));

        calculator.computeMastery(USER, LESSON);
        calculator.computeMastery(USER, LESSON);
        clock.advance(Duration.ofSeconds(61));
        calculator.computeMastery(USER, LESSON);

        verify(store, times(2)).forLesson(USER, LESSON);
    }

    @Test
    void recordingEvidenceInvalidatesCachedScore() {
        EvidenceRecord wrong = evidence(INCORRECT_ANSWER, 20);
        when(store.forLesson(USER, LESSON))
                .thenReturn(List.of(evidence(CORRECT_ANSWER, 90)))
                .thenReturn(List.of(evidence(CORRECT_ANSWER, 90), wrong));
        when(store.append(any())).thenAnswer(inv -> inv.getArgument(0));

        assertThat(calculator.computeMastery(USER, LESSON)).isEqualTo(100);
        calculator.recordEvidence(wrong);

        assertThat(calculator.computeMastery(USER, LESSON)).isEqualTo(50);
    }
}
