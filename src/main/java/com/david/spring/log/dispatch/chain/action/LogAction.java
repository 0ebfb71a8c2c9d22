package com.david.spring.log.dispatch.chain.action;

import com.david.spring.log.dispatch.model.LogMessage;

/** Side effect run by a handler once it has claimed a message. */
@FunctionalInterface
public interface LogAction {

    /**
     * Perform the side effect.
     *
     * @param message the claimed message
     * @throws com.david.spring.log.dispatch.exception.LogDispatchException for terminal policies
     */
    void perform(LogMessage message);
}
