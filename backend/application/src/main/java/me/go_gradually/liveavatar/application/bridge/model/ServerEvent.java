package me.go_gradually.liveavatar.application.bridge.model;

import java.util.List;

public interface ServerEvent {
    ServerEventType type();

    record SessionUpdated(String sessionId, List<IceServer> iceServers) implements ServerEvent {
        public SessionUpdated {
            iceServers = iceServers == null ? List.of() : List.copyOf(iceServers);
        }

        @Override
        public ServerEventType type() {
            return ServerEventType.SESSION_UPDATED;
        }
    }

    record AvatarConnecting(String serverSdp) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.SESSION_AVATAR_CONNECTING;
        }
    }

    record AudioDelta(String delta) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_AUDIO_DELTA;
        }
    }

    record AudioDone() implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_AUDIO_DONE;
        }
    }

    record AudioTranscriptDelta(String delta) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_AUDIO_TRANSCRIPT_DELTA;
        }
    }

    record AudioTranscriptDone(String transcript) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_AUDIO_TRANSCRIPT_DONE;
        }
    }

    record TextDelta(String delta) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_TEXT_DELTA;
        }
    }

    record TextDone(String text) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_TEXT_DONE;
        }
    }

    record ResponseCreated(String responseId) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_CREATED;
        }
    }

    record ResponseDone() implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_DONE;
        }
    }

    record SpeechStarted(String itemId) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.INPUT_AUDIO_BUFFER_SPEECH_STARTED;
        }
    }

    record SpeechStopped() implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.INPUT_AUDIO_BUFFER_SPEECH_STOPPED;
        }
    }

    record InputTranscriptionCompleted(String itemId, String transcript) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.INPUT_AUDIO_TRANSCRIPTION_COMPLETED;
        }
    }

    record ItemCreated(String itemId, String itemType, String name, String callId) implements ServerEvent {
        public boolean isFunctionCall() {
            return "function_call".equals(itemType) && callId != null && !callId.isBlank();
        }

        @Override
        public ServerEventType type() {
            return ServerEventType.CONVERSATION_ITEM_CREATED;
        }
    }

    record FunctionCallArgumentsDone(String callId, String name, String arguments) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.FUNCTION_CALL_ARGUMENTS_DONE;
        }
    }

    record ServiceError(String code, String message) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.ERROR;
        }
    }

    record VideoDelta(String delta) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.RESPONSE_VIDEO_DELTA;
        }
    }

    record Unknown(String rawType) implements ServerEvent {
        @Override
        public ServerEventType type() {
            return ServerEventType.UNKNOWN;
        }
    }
}
