package me.go_gradually.liveavatar.domain.session;

import me.go_gradually.liveavatar.domain.voice.VoiceSelection;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionConfigTest {

    private final VoiceSelection voice = VoiceSelection.standard("en-US-AvaNeural", 0.9, 1.0);

    @Test
    void sessionModel_usesModeCodeForAgents() {
        SessionConfig config = SessionConfig.builder("gpt-4o-realtime", voice)
                .mode(ConnectionMode.AGENT)
                .agent("agent-1", null, "project-1")
                .build();

        assertEquals("agent", config.sessionModel());
        assertTrue(config.sendsTemperature());
    }

    @Test
    void sendsTemperature_falseForAgentV2() {
        SessionConfig config = SessionConfig.builder("gpt-4o-realtime", voice)
                .mode(ConnectionMode.AGENT_V2)
                .build();

        assertFalse(config.sendsTemperature());
        assertEquals("agent-v2", config.sessionModel());
    }

    @Test
    void constructor_copiesSessionExtensions() {
        Map<String, Object> extensions = new HashMap<>();
        extensions.put("max_response_output_tokens", 200);
        SessionConfig config = SessionConfig.builder("gpt-4o-realtime", voice).sessionExtensions(extensions).build();

        extensions.put("late", true);

        assertEquals(Map.of("max_response_output_tokens", 200), config.sessionExtensions());
        assertTrue(config.tools().isEmpty());
        assertFalse(config.avatarEnabled());
    }

    @Test
    void constructor_requiresModel() {
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder(" ", voice).build());
    }
}
