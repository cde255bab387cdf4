package com.openforge.tutor.context;

import com.openforge.tutor.domain.Lesson;
import com.openforge.tutor.domain.PendingCorrection;
import com.openforge.tutor.profile.LearnerProfile;

import java.util.List;

/**
 * Everything loaded for a turn before any model is called.
 *
 * @param recentHistory     oldest first
 * @param activeResponder   last non-coordinator responder, or null
 * @param pendingCorrection oldest undelivered correction, or null
 */
public record TeachingContext(
        LearnerProfile profile,
        List<ConversationTurn> recentHistory,
        Lesson lesson,
        String activeResponder,
        int currentMastery,
        PendingCorrection pendingCorrection
) {

    public TeachingContext {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    }

    public boolean hasPendingCorrection() {
        return pendingCorrection != null;
    }
}
