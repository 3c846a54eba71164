package me.go_gradually.liveavatar.domain.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TranscriptionOptionsTest {

    @Test
    void resolve_usesWhisperForRealtimeModels() {
        TranscriptionOptions options = TranscriptionOptions.resolve(ConnectionMode.MODEL, "gpt-4o-realtime", "azure-speech", "en-US");

        assertEquals("whisper-1", options.model());
        assertEquals("en-US", options.language());
    }

    @Test
    void resolve_usesRequestedSpeechModelOtherwise() {
        TranscriptionOptions options = TranscriptionOptions.resolve(ConnectionMode.MODEL, "gpt-4.1", null, "auto");

        assertEquals("azure-speech", options.model());
        assertNull(options.language());
    }

    @Test
    void resolve_agentModesIgnoreRealtimeModelName() {
        TranscriptionOptions options = TranscriptionOptions.resolve(ConnectionMode.AGENT, "gpt-4o-realtime", "mai-ears-1", "ko-KR");

        assertEquals("mai-ears-1", options.model());
        assertNull(options.language());
    }
}
