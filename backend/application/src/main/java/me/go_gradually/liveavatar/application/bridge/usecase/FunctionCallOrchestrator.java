package me.go_gradually.liveavatar.application.bridge.usecase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.model.ClientSink;
import me.go_gradually.liveavatar.application.bridge.model.FunctionCallException;
import me.go_gradually.liveavatar.application.bridge.model.OutboundMessage;
import me.go_gradually.liveavatar.application.bridge.model.ServerEvent;
import me.go_gradually.liveavatar.application.bridge.model.ServerEventType;
import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamConnection;
import me.go_gradually.liveavatar.application.shared.port.MetricsPort;
import me.go_gradually.liveavatar.application.tool.usecase.ToolRegistry;
import me.go_gradually.liveavatar.domain.functioncall.FunctionCallContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.logging.Logger;

public class FunctionCallOrchestrator {
    private static final Logger log = Logger.getLogger(FunctionCallOrchestrator.class.getName());
    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final BridgePolicy policy;
    private final MetricsPort metrics;

    public FunctionCallOrchestrator(ToolRegistry toolRegistry,
                                    ObjectMapper objectMapper,
                                    BridgePolicy policy,
                                    MetricsPort metrics) {
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.policy = policy;
        this.metrics = metrics;
    }

    public void orchestrate(ServerEvent.ItemCreated item,
                            Map<String, FunctionCallContext> inFlight,
                            EventWaiter waiter,
                            UpstreamConnection connection,
                            ClientSink sink) throws InterruptedException {
        String functionName = item.name() == null || item.name().isBlank() ? "unknown" : item.name();
        String callId = item.callId();
        if (!inFlight.isEmpty()) {
            log.warning("function_call.rejected reason=already_in_flight callId=" + callId
                    + " inFlight=" + inFlight.keySet());
            metrics.incrementFunctionCallError();
            sink.send(OutboundMessage.functionCallError(functionName, callId,
                    "Another function call is already in progress"));
            return;
        }

        FunctionCallContext context = new FunctionCallContext(callId, functionName, item.itemId());
        inFlight.put(callId, context);
        Instant startedAt = Instant.now();
        log.info(() -> "function_call.started name=" + functionName + " callId=" + callId);
        sink.send(OutboundMessage.functionCallStarted(functionName, callId));
        try {
            run(context, waiter, connection, sink);
        } catch (FunctionCallException e) {
            if (!context.status().isFinished()) {
                context.fail();
            }
            metrics.incrementFunctionCallError();
            log.warning("function_call.failed name=" + functionName + " callId=" + callId
                    + " status=" + context.status() + " reason=" + e.getMessage());
            sink.send(OutboundMessage.functionCallError(functionName, callId, e.getMessage()));
        } finally {
            inFlight.remove(callId);
            metrics.recordFunctionCallLatency(Duration.between(startedAt, Instant.now()));
        }
    }

    private void run(FunctionCallContext context,
                     EventWaiter waiter,
                     UpstreamConnection connection,
                     ClientSink sink) throws InterruptedException {
        Duration timeout = policy.functionCallTimeout();
        ServerEvent argumentsEvent = waiter.await(ServerEventType.FUNCTION_CALL_ARGUMENTS_DONE, timeout);
        if (argumentsEvent == null) {
            context.timeOut();
            throw new FunctionCallException("Timed out waiting for function call arguments");
        }
        ServerEvent.FunctionCallArgumentsDone arguments = (ServerEvent.FunctionCallArgumentsDone) argumentsEvent;
        if (!context.callId().equals(arguments.callId())) {
            // 다른 호출의 인자이므로 실행하지 않고 버린다.
            log.warning("function_call.mismatch expected=" + context.callId() + " actual=" + arguments.callId());
            context.fail();
            return;
        }
        context.argumentsReceived(arguments.arguments());

        if (waiter.await(ServerEventType.RESPONSE_DONE, timeout) == null) {
            context.timeOut();
            throw new FunctionCallException("Timed out waiting for response completion");
        }

        context.startExecution();
        Map<String, Object> result = execute(context);
        String output = toJson(result);
        context.complete();
        metrics.incrementFunctionCallCompleted();
        sink.send(OutboundMessage.functionCallResult(context.functionName(), context.callId(), result));
        connection.createFunctionCallOutput(context.itemId(), context.callId(), output);
        connection.createResponse();
        log.info(() -> "function_call.completed name=" + context.functionName() + " callId=" + context.callId());
    }

    private Map<String, Object> execute(FunctionCallContext context) {
        Map<String, Object> arguments = parseArguments(context.arguments());
        try {
            return toolRegistry.invoke(context.functionName(), arguments);
        } catch (RuntimeException e) {
            throw new FunctionCallException("Function execution failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> parseArguments(String raw) {
        try {
            Map<String, Object> parsed = objectMapper.readValue(raw, ARGUMENTS_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warning("function_call.arguments_unparsable reason=" + e.getOriginalMessage());
            return Map.of();
        }
    }

    private String toJson(Map<String, Object> result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new FunctionCallException("Function result could not be serialized", e);
        }
    }
}
