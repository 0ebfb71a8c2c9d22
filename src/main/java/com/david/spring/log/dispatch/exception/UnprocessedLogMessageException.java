package com.david.spring.log.dispatch.exception;

import com.david.spring.log.dispatch.model.LogMessage;

/** Raised by the catch-all handler for messages no specific handler recognised. */
public class UnprocessedLogMessageException extends LogDispatchException {

    public static final String DESCRIPTION_PREFIX = "Unprocessed message: ";

    public UnprocessedLogMessageException(LogMessage logMessage) {
        super(DESCRIPTION_PREFIX + logMessage.text(), logMessage);
    }
}
