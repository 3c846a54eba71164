package me.go_gradually.liveavatar.domain.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConnectionModeTest {

    @Test
    void fromCode_defaultsToModelWhenBlank() {
        assertEquals(ConnectionMode.MODEL, ConnectionMode.fromCode(null));
        assertEquals(ConnectionMode.MODEL, ConnectionMode.fromCode(" "));
    }

    @Test
    void fromCode_acceptsAgentModesCaseInsensitively() {
        assertEquals(ConnectionMode.AGENT, ConnectionMode.fromCode("Agent"));
        assertEquals(ConnectionMode.AGENT_V2, ConnectionMode.fromCode("agent-v2"));
    }

    @Test
    void fromCode_rejectsUnknownMode() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionMode.fromCode("assistant"));
    }
}
