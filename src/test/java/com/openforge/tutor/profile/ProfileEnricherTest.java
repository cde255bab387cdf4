package com.openforge.tutor.profile;

import com.openforge.tutor.domain.EvidenceRecord;
import com.openforge.tutor.domain.EvidenceType;
import com.openforge.tutor.mastery.EvidenceStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.openforge.tutor.domain.EvidenceType.CORRECT_ANSWER;
import static com.openforge.tutor.domain.EvidenceType.INCORRECT_ANSWER;
import static com.openforge.tutor.domain.EvidenceType.STRUGGLE;
import static com.openforge.tutor.testutil.Fixtures.SESSION;
import static com.openforge.tutor.testutil.Fixtures.USER;
import static com.openforge.tutor.testutil.Fixtures.LESSON;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProfileEnricherTest {

    private final EvidenceStore store = mock(EvidenceStore.class);
    private final ProfileService profiles = mock(ProfileService.class);
    private final ProfileEnricher enricher = new ProfileEnricher(store, profiles);

    private static EvidenceRecord on(String topic, EvidenceType type, Integer quality) {
        return EvidenceRecord.builder()
                .userId(USER)
                .sessionId(SESSION)
                .lessonId(LESSON)
                .evidenceType(type)
                .content("answer")
                .qualityScore(quality)
                .confidence(0.9)
                .context(topic)
                .build();
    }

    @Test
    void repeatedStrugglesAndStrongAnswersArePromoted() {
        List<EvidenceRecord> window = new ArrayList<>();
        window.add(on("Fractions", INCORRECT_ANSWER, 10));
        window.add(on("Fractions", STRUGGLE, 0));
        window.add(on("Fractions", INCORRECT_ANSWER, 20));
        window.add(on("Counting", CORRECT_ANSWER, 90));
        window.add(on("Counting", CORRECT_ANSWER, 80));
        window.add(on("Decimals", CORRECT_ANSWER, 95));
        window.add(on("Decimals", CORRECT_ANSWER, 60));

        ProfileEnricher.Patterns patterns = ProfileEnricher.analyze(window);

        assertThat(patterns.newStruggles()).containsExactly("Fractions");
        assertThat(patterns.newStrengths()).containsExactly("Counting");
    }

    @Test
    void recordsWithoutTopicAreIgnored() {
        ProfileEnricher.Patterns patterns = ProfileEnricher.analyze(List.of(
                on(null, STRUGGLE, 0), on(" ", STRUGGLE, 0), on(null, STRUGGLE, 0)));

        assertThat(patterns.isEmpty()).isTrue();
    }

    @Test
    void writesOnlyWhenPatternsExist() {
        when(store.recentForSession(SESSION, ProfileEnricher.WINDOW)).thenReturn(List.of(
                on("Fractions", STRUGGLE, 0)));

        enricher.enrichIfNeeded(USER, SESSION);

        verify(profiles, never()).addTopics(anyString(), any(), any());
    }

    @Test
    void mergesPatternsIntoProfile() {
        when(store.recentForSession(SESSION, ProfileEnricher.WINDOW)).thenReturn(List.of(
                on("Fractions", STRUGGLE, 0), on("Fractions", STRUGGLE, 0), on("Fractions", INCORRECT_ANSWER, 5)));
        when(profiles.addTopics(USER, List.of("Fractions"), List.of())).thenReturn(true);

        ProfileEnricher.Patterns patterns = enricher.enrichIfNeeded(USER, SESSION);

        assertThat(patterns.newStruggles()).containsExactly("Fractions");
        verify(profiles).addTopics(USER, List.of("Fractions"), List.of());
    }
}
