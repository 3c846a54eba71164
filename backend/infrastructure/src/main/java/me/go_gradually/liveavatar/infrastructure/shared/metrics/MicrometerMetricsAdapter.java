package me.go_gradually.liveavatar.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.liveavatar.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordSessionSetupLatency(Duration duration) {
        record("voicelive.session.setup.latency", duration);
    }

    @Override
    public void recordFunctionCallLatency(Duration duration) {
        record("voicelive.function_call.latency", duration);
    }

    @Override
    public void incrementSessionStarted() {
        meterRegistry.counter("voicelive.session.started").increment();
    }

    @Override
    public void incrementSessionFailed() {
        meterRegistry.counter("voicelive.session.failed").increment();
    }

    @Override
    public void incrementSessionClosed() {
        meterRegistry.counter("voicelive.session.closed").increment();
    }

    @Override
    public void incrementFunctionCallCompleted() {
        meterRegistry.counter("voicelive.function_call.completed").increment();
    }

    @Override
    public void incrementFunctionCallError() {
        meterRegistry.counter("voicelive.function_call.errors").increment();
    }

    @Override
    public void incrementEventReceived(String eventType) {
        String type = eventType == null || eventType.isBlank() ? "unknown" : eventType;
        meterRegistry.counter("voicelive.event.received", "type", type).increment();
    }

    @Override
    public void incrementRecoverableEventError() {
        meterRegistry.counter("voicelive.event.recoverable_errors").increment();
    }

    @Override
    public void incrementAudioChunkDropped() {
        meterRegistry.counter("voicelive.session.audio_dropped").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
