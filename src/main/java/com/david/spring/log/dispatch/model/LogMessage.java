package com.david.spring.log.dispatch.model;

import org.springframework.util.Assert;

/**
 * Immutable log event submitted to a {@code LogHandlerChain}.
 *
 * @param severity classification used for routing
 * @param text     payload written or raised by the claiming handler
 */
public record LogMessage(Severity severity, String text) {

    public LogMessage {
        Assert.notNull(severity, "Severity must not be null");
        Assert.notNull(text, "Message text must not be null");
    }

    public static LogMessage of(Severity severity, String text) {
        return new LogMessage(severity, text);
    }

    public static LogMessage warning(String text) {
        return new LogMessage(Severity.WARNING, text);
    }

    public static LogMessage error(String text) {
        return new LogMessage(Severity.ERROR, text);
    }

    public static LogMessage fatalError(String text) {
        return new LogMessage(Severity.FATAL_ERROR, text);
    }

    public static LogMessage unclassified(String text) {
        return new LogMessage(Severity.UNCLASSIFIED, text);
    }
}
