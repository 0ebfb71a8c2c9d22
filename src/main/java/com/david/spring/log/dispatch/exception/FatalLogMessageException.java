package com.david.spring.log.dispatch.exception;

import com.david.spring.log.dispatch.model.LogMessage;

/** Raised for fatal messages; the description is the message text verbatim. */
public class FatalLogMessageException extends LogDispatchException {

    public FatalLogMessageException(LogMessage logMessage) {
        super(logMessage.text(), logMessage);
    }
}
