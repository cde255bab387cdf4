package com.openforge.tutor.speech;

import com.openforge.tutor.agent.AgentNames;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/** Agent → voice lookup.  Configured overrides win over the built-in table. */
@Component
public class VoiceCatalog {

    public static final String DEFAULT_VOICE = "en-US-Neural2-F";

    private static final Map<String, String> BUILT_IN = Map.of(
            AgentNames.COORDINATOR,        "en-US-Neural2-F",
            AgentNames.MATH_SPECIALIST,    "en-US-Neural2-A",
            AgentNames.SCIENCE_SPECIALIST, "en-US-Neural2-C",
            AgentNames.ENGLISH_SPECIALIST, "en-US-Neural2-H",
            AgentNames.HISTORY_SPECIALIST, "en-US-Neural2-D",
            AgentNames.ART_SPECIALIST,     "en-US-Neural2-E",
            AgentNames.ASSESSOR,           "en-US-Neural2-H",
            AgentNames.MOTIVATOR,          "en-US-Neural2-C"
    );

    private final Map<String, String> voices;

    public VoiceCatalog(SpeechProperties properties) {
        Map<String, String> merged = new HashMap<>(BUILT_IN);
        if (properties.voices() != null) {
            merged.putAll(properties.voices());
        }
        this.voices = Map.copyOf(merged);
    }

    public String voiceFor(String agentName) {
        if (agentName == null) return DEFAULT_VOICE;
        return voices.getOrDefault(agentName, DEFAULT_VOICE);
    }
}
