package com.openforge.tutor.routing;

/**
 * Raw routing JSON produced by the coordinator model:
 * {@code {"route_to": "...", "reason": "...", "handoff_message": "...", "response": "..."}}.
 * Field names bind through the shared snake_case ObjectMapper.
 */
public record CoordinatorDecision(
        String routeTo,
        String reason,
        String handoffMessage,
        String response
) {}
