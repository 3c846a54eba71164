package me.go_gradually.liveavatar.domain.functioncall;

public enum FunctionCallStatus {
    AWAITING_ARGUMENTS,
    AWAITING_RESPONSE_DONE,
    EXECUTING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }

    public boolean canTransitionTo(FunctionCallStatus next) {
        if (next == null || isFinished()) {
            return false;
        }
        return switch (this) {
            case AWAITING_ARGUMENTS -> next == AWAITING_RESPONSE_DONE || next == FAILED || next == TIMED_OUT;
            case AWAITING_RESPONSE_DONE -> next == EXECUTING || next == FAILED || next == TIMED_OUT;
            case EXECUTING -> next == COMPLETED || next == FAILED;
            default -> false;
        };
    }
}
