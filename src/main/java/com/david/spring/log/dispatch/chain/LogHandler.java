package com.david.spring.log.dispatch.chain;

import com.david.spring.log.dispatch.model.LogMessage;
import com.david.spring.log.dispatch.model.Severity;

import jakarta.annotation.Nullable;

/**
 * Log message handler (chain of responsibility).
 * <p>
 * A handler claims exactly one {@link Severity}. A message of that severity is
 * consumed by the handler; any other message is forwarded unchanged to the
 * successor, or dropped when there is none.
 * </p>
 */
public interface LogHandler {

    /**
     * Handle a message or forward it.
     *
     * @param message the message to dispatch
     * @return the dispatch result
     * @throws com.david.spring.log.dispatch.exception.LogDispatchException when a terminal handler claims the message
     */
    DispatchResult handle(LogMessage message);

    /**
     * Install the successor, replacing any previous one.
     *
     * @param next the next handler, null to end the chain here
     */
    void setNext(@Nullable LogHandler next);

    @Nullable
    LogHandler getNext();

    /** The single severity this handler claims. */
    Severity getSeverity();

    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Forward to the successor.
     *
     * @param message the message to forward
     * @return the successor's result, or {@link DispatchOutcome#DROPPED} at the end of the chain
     */
    default DispatchResult invokeNext(LogMessage message) {
        LogHandler next = getNext();
        if (next != null) {
            return next.handle(message);
        }
        return DispatchResult.dropped(message);
    }
}
