package com.david.spring.log.dispatch.chain.action;

import com.david.spring.log.dispatch.exception.FatalLogMessageException;
import com.david.spring.log.dispatch.model.LogMessage;

/** Aborts dispatch with the message text as the failure description. */
public class FatalErrorAction implements LogAction {

    @Override
    public void perform(LogMessage message) {
        throw new FatalLogMessageException(message);
    }
}
