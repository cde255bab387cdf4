package com.openforge.tutor.teaching;

import com.openforge.tutor.context.StudentInput;
import lombok.Builder;

/** One inbound student turn, as handed over by the request layer. */
@Builder
public record TurnRequest(
        String userId,
        String sessionId,
        String lessonId,
        StudentInput input
) {

    public static TurnRequest text(String userId, String sessionId, String lessonId, String message) {
        return new TurnRequest(userId, sessionId, lessonId, StudentInput.text(message));
    }

    /** Message as stored in the interaction log. */
    public String loggedMessage() {
        return input != null && input.hasText() ? input.message() : "[Audio/Media input]";
    }
}
