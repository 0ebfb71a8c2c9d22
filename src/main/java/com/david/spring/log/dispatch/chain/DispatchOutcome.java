package com.david.spring.log.dispatch.chain;

/** How a single dispatch through the chain ended. */
public enum DispatchOutcome {
    /** A handler claimed the message and ran its action */
    HANDLED,
    /** The chain was exhausted without a matching handler */
    DROPPED,
    /** A terminal handler raised a hard failure */
    FAILED
}
