package com.david.spring.log.dispatch.exception;

import com.david.spring.log.dispatch.model.LogMessage;
import com.david.spring.log.dispatch.model.Severity;

import lombok.Getter;

/**
 * Hard failure raised by a terminal handler.
 * <p>
 * Callers of {@code LogHandlerChain#execute} should expect it for
 * {@link Severity#FATAL_ERROR} and {@link Severity#UNCLASSIFIED} messages;
 * {@code LogHandlerChain#dispatch} reports it as a failed result instead.
 * </p>
 */
@Getter
public abstract class LogDispatchException extends RuntimeException {

    /** Message whose dispatch was aborted */
    private final transient LogMessage logMessage;

    protected LogDispatchException(String description, LogMessage logMessage) {
        super(description);
        this.logMessage = logMessage;
    }

    public Severity getSeverity() {
        return logMessage.severity();
    }
}
