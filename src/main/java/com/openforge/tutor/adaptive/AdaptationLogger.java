package com.openforge.tutor.adaptive;

import com.openforge.tutor.domain.AdaptationLog;
import com.openforge.tutor.repository.AdaptationLogRepository;
import com.openforge.tutor.task.BackgroundTasks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Records which directives were applied to each turn, for analytics only.
 * The write is fire-and-forget through {@link BackgroundTasks}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptationLogger {

    private static final int PREVIEW_LENGTH = 200;

    private final AdaptationLogRepository repository;
    private final BackgroundTasks         backgroundTasks;

    public CompletableFuture<Void> log(String userId,
                                       String lessonId,
                                       String sessionId,
                                       AdaptiveDirectives directives,
                                       String learningStyle,
                                       String responseText,
                                       boolean hasSvg) {
        AdaptationLog entry = AdaptationLog.builder()
                .userId(userId)
                .lessonId(lessonId)
                .sessionId(sessionId)
                .masteryLevel(directives.currentMastery())
                .learningStyle(learningStyle)
                .difficultyLevel(difficultyLevel(directives))
                .scaffoldingLevel(directives.encouragementLevel().label())
                .responsePreview(preview(responseText))
                .hasSvg(hasSvg)
                .directiveCount(directives.directiveCount())
                .build();

        return backgroundTasks.submit("adaptation-log", () -> {
            repository.save(entry);
            log.info("[Adaptation] Logged mastery={} difficulty={} scaffolding={} svg={}",
                    entry.getMasteryLevel(), entry.getDifficultyLevel(), entry.getScaffoldingLevel(), hasSvg);
        });
    }

    /** simplified / standard / accelerated, read back from the difficulty block text. */
    static String difficultyLevel(AdaptiveDirectives directives) {
        String text = String.join(" ", directives.difficultyAdjustments()).toLowerCase(Locale.ROOT);
        if (text.contains("simplification mode") || text.contains("low mastery")) {
            return "simplified";
        }
        if (text.contains("acceleration mode") || text.contains("high mastery")) {
            return "accelerated";
        }
        return "standard";
    }

    private static String preview(String text) {
        if (text == null) return "";
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text;
    }
}
