package me.go_gradually.liveavatar.application.bridge.usecase;

import me.go_gradually.liveavatar.application.bridge.model.OutboundMessage;
import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.domain.session.ClientId;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

public class EventTranslator {
    private static final Logger log = Logger.getLogger(EventTranslator.class.getName());
    private static final int VIDEO_LOG_HEAD = 5;
    private static final int VIDEO_LOG_INTERVAL = 100;

    private final ClientId clientId;
    private final AtomicLong videoDeltaCount = new AtomicLong();

    public EventTranslator(ClientId clientId) {
        this.clientId = clientId;
    }

    public Optional<OutboundMessage> translate(ServerEvent event) {
        return switch (event.type()) {
            case RESPONSE_AUDIO_DELTA -> nonBlank(((ServerEvent.AudioDelta) event).delta())
                    .map(OutboundMessage::audioData);
            case RESPONSE_AUDIO_DONE -> Optional.of(OutboundMessage.audioDone());
            case RESPONSE_AUDIO_TRANSCRIPT_DELTA -> nonBlank(((ServerEvent.AudioTranscriptDelta) event).delta())
                    .map(delta -> OutboundMessage.transcriptDelta(OutboundMessage.ROLE_ASSISTANT, delta));
            case RESPONSE_AUDIO_TRANSCRIPT_DONE -> Optional.of(OutboundMessage.transcriptDone(
                    OutboundMessage.ROLE_ASSISTANT, ((ServerEvent.AudioTranscriptDone) event).transcript(), null));
            case RESPONSE_TEXT_DELTA -> nonBlank(((ServerEvent.TextDelta) event).delta())
                    .map(OutboundMessage::textDelta);
            case RESPONSE_TEXT_DONE -> Optional.of(OutboundMessage.textDone(((ServerEvent.TextDone) event).text()));
            case RESPONSE_CREATED -> Optional.of(OutboundMessage.responseCreated(
                    ((ServerEvent.ResponseCreated) event).responseId()));
            case RESPONSE_DONE -> Optional.of(OutboundMessage.responseDone());
            case INPUT_AUDIO_BUFFER_SPEECH_STARTED -> Optional.of(OutboundMessage.speechStarted(
                    ((ServerEvent.SpeechStarted) event).itemId()));
            case INPUT_AUDIO_BUFFER_SPEECH_STOPPED -> Optional.of(OutboundMessage.speechStopped());
            case INPUT_AUDIO_TRANSCRIPTION_COMPLETED -> userTranscript((ServerEvent.InputTranscriptionCompleted) event);
            case SESSION_AVATAR_CONNECTING -> avatarAnswer((ServerEvent.AvatarConnecting) event);
            case ERROR -> serviceError((ServerEvent.ServiceError) event);
            case RESPONSE_VIDEO_DELTA -> videoDelta((ServerEvent.VideoDelta) event);
            case SESSION_UPDATED -> {
                log.info(() -> "bridge.event.session_updated clientId=" + clientId
                        + " sessionId=" + ((ServerEvent.SessionUpdated) event).sessionId());
                yield Optional.empty();
            }
            // 함수 호출 이벤트는 오케스트레이터가 처리한다.
            case CONVERSATION_ITEM_CREATED, FUNCTION_CALL_ARGUMENTS_DONE -> Optional.empty();
            case UNKNOWN -> {
                log.fine(() -> "bridge.event.unhandled clientId=" + clientId
                        + " type=" + ((ServerEvent.Unknown) event).rawType());
                yield Optional.empty();
            }
        };
    }

    static boolean isIgnorableError(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("no active response found") || normalized.contains("cancellation failed")) {
            return true;
        }
        return normalized.contains("buffer too small");
    }

    private Optional<OutboundMessage> userTranscript(ServerEvent.InputTranscriptionCompleted event) {
        if (event.transcript() == null || event.transcript().isEmpty()) {
            return Optional.empty();
        }
        String itemId = event.itemId() == null ? "" : event.itemId();
        return Optional.of(OutboundMessage.transcriptDone(OutboundMessage.ROLE_USER, event.transcript(), itemId));
    }

    private Optional<OutboundMessage> avatarAnswer(ServerEvent.AvatarConnecting event) {
        if (event.serverSdp() == null || event.serverSdp().isBlank()) {
            log.warning("bridge.avatar.empty_answer clientId=" + clientId);
            return Optional.empty();
        }
        return Optional.of(OutboundMessage.avatarSdpAnswer(event.serverSdp()));
    }

    private Optional<OutboundMessage> serviceError(ServerEvent.ServiceError event) {
        String message = firstNonBlank(event.message(), event.code(), "Unknown service error");
        if (isIgnorableError(message)) {
            log.info(() -> "bridge.event.error_ignored clientId=" + clientId + " message=" + message);
            return Optional.empty();
        }
        log.warning("bridge.event.error clientId=" + clientId + " message=" + message);
        return Optional.of(OutboundMessage.error(message));
    }

    private Optional<OutboundMessage> videoDelta(ServerEvent.VideoDelta event) {
        if (event.delta() == null || event.delta().isEmpty()) {
            return Optional.empty();
        }
        long count = videoDeltaCount.incrementAndGet();
        if (count <= VIDEO_LOG_HEAD || count % VIDEO_LOG_INTERVAL == 0) {
            log.info(() -> "bridge.video.delta clientId=" + clientId + " count=" + count
                    + " length=" + event.delta().length());
        }
        return Optional.of(OutboundMessage.videoData(event.delta()));
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }
}
