package me.go_gradually.liveavatar.domain.functioncall;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FunctionCallContextTest {

    @Test
    void lifecycle_movesThroughExpectedStates() {
        FunctionCallContext context = new FunctionCallContext("call-1", "get_time", "item-1");

        context.argumentsReceived("");
        assertEquals("{}", context.arguments());
        assertEquals(FunctionCallStatus.AWAITING_RESPONSE_DONE, context.status());

        context.startExecution();
        context.complete();
        assertEquals(FunctionCallStatus.COMPLETED, context.status());
    }

    @Test
    void executionCannotStartBeforeArguments() {
        FunctionCallContext context = new FunctionCallContext("call-1", "get_time", "item-1");

        assertThrows(IllegalStateException.class, context::startExecution);
    }

    @Test
    void finishedCallRejectsFurtherTransitions() {
        FunctionCallContext context = new FunctionCallContext("call-1", "get_time", null);
        context.timeOut();

        assertThrows(IllegalStateException.class, context::fail);
    }
}
