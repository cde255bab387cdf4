package com.openforge.tutor.context;

import com.openforge.tutor.domain.Interaction;

/** One past exchange, detached from the persistence entity. */
public record ConversationTurn(String agentName, String userMessage, String agentResponse) {

    public static ConversationTurn of(Interaction interaction) {
        return new ConversationTurn(
                interaction.getAgentName(),
                interaction.getUserMessage(),
                interaction.getAgentResponse());
    }
}
