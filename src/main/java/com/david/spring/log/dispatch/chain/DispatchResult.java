package com.david.spring.log.dispatch.chain;

import com.david.spring.log.dispatch.exception.LogDispatchException;
import com.david.spring.log.dispatch.model.LogMessage;
import com.david.spring.log.dispatch.model.Severity;

import jakarta.annotation.Nullable;

/**
 * Result of dispatching one message.
 *
 * @param outcome     how dispatch ended
 * @param message     the dispatched message
 * @param handlerName name of the claiming handler, null unless {@link DispatchOutcome#HANDLED}
 * @param failure     the hard failure, null unless {@link DispatchOutcome#FAILED}
 */
public record DispatchResult(
        DispatchOutcome outcome,
        LogMessage message,
        @Nullable String handlerName,
        @Nullable LogDispatchException failure) {

    public static DispatchResult handled(LogMessage message, String handlerName) {
        return new DispatchResult(DispatchOutcome.HANDLED, message, handlerName, null);
    }

    public static DispatchResult dropped(LogMessage message) {
        return new DispatchResult(DispatchOutcome.DROPPED, message, null, null);
    }

    public static DispatchResult failed(LogMessage message, LogDispatchException failure) {
        return new DispatchResult(DispatchOutcome.FAILED, message, null, failure);
    }

    public Severity severity() {
        return message.severity();
    }

    public boolean isHandled() {
        return outcome == DispatchOutcome.HANDLED;
    }

    public boolean isDropped() {
        return outcome == DispatchOutcome.DROPPED;
    }

    public boolean isFailed() {
        return outcome == DispatchOutcome.FAILED;
    }
}
