package me.go_gradually.liveavatar.domain.functioncall;

public final class FunctionCallContext {
    private final String callId;
    private final String functionName;
    private final String itemId;
    private String arguments;
    private FunctionCallStatus status = FunctionCallStatus.AWAITING_ARGUMENTS;

    public FunctionCallContext(String callId, String functionName, String itemId) {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("Call id is required");
        }
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("Function name is required");
        }
        this.callId = callId;
        this.functionName = functionName;
        this.itemId = itemId;
    }

    public String callId() {
        return callId;
    }

    public String functionName() {
        return functionName;
    }

    public String itemId() {
        return itemId;
    }

    public String arguments() {
        return arguments;
    }

    public FunctionCallStatus status() {
        return status;
    }

    public void argumentsReceived(String rawArguments) {
        moveTo(FunctionCallStatus.AWAITING_RESPONSE_DONE);
        this.arguments = rawArguments == null || rawArguments.isBlank() ? "{}" : rawArguments;
    }

    public void startExecution() {
        moveTo(FunctionCallStatus.EXECUTING);
    }

    public void complete() {
        moveTo(FunctionCallStatus.COMPLETED);
    }

    public void fail() {
        moveTo(FunctionCallStatus.FAILED);
    }

    public void timeOut() {
        moveTo(FunctionCallStatus.TIMED_OUT);
    }

    private void moveTo(FunctionCallStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid function call transition: " + status + " -> " + next);
        }
        status = next;
    }
}
