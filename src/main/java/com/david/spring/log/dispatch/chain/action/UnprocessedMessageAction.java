package com.david.spring.log.dispatch.chain.action;

import com.david.spring.log.dispatch.exception.UnprocessedLogMessageException;
import com.david.spring.log.dispatch.model.LogMessage;

/** Catch-all action: makes an unrecognised message fail loudly. */
public class UnprocessedMessageAction implements LogAction {

    @Override
    public void perform(LogMessage message) {
        throw new UnprocessedLogMessageException(message);
    }
}
