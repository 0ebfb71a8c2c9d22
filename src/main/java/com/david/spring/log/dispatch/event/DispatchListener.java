package com.david.spring.log.dispatch.event;

import com.david.spring.log.dispatch.chain.DispatchResult;

/** Observer notified once per dispatch, after the chain has finished with the message. */
@FunctionalInterface
public interface DispatchListener {

    /**
     * @param result the dispatch result; failed dispatches are reported before the failure propagates
     */
    void onDispatch(DispatchResult result);
}
