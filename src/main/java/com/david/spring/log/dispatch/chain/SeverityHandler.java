package com.david.spring.log.dispatch.chain;

import com.david.spring.log.dispatch.chain.action.LogAction;
import com.david.spring.log.dispatch.model.LogMessage;
import com.david.spring.log.dispatch.model.Severity;

import jakarta.annotation.Nullable;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.springframework.util.Assert;

/**
 * Handler built from a (severity, action) pair.
 * <p>
 * Runs its action when the message severity matches and stops there;
 * otherwise forwards to the successor. The action's own outcome never causes
 * forwarding: a terminal action raises straight out of the chain.
 * </p>
 */
@Slf4j
@Getter
public final class SeverityHandler implements LogHandler {

    private final String name;

    private final Severity severity;

    private final LogAction action;

    @Nullable
    private LogHandler next;

    public SeverityHandler(String name, Severity severity, LogAction action) {
        Assert.hasText(name, "Handler name must not be empty");
        Assert.notNull(severity, "Handler severity must not be null");
        Assert.notNull(action, "Handler action must not be null");
        this.name = name;
        this.severity = severity;
        this.action = action;
    }

    @Override
    public DispatchResult handle(LogMessage message) {
        Assert.notNull(message, "Log message must not be null");

        if (message.severity() != severity) {
            if (next == null) {
                log.debug("[{}] End of chain reached, dropping message: severity={}", name, message.severity());
            } else {
                log.debug("[{}] Forwarding message: severity={}, next={}", name, message.severity(), next.getName());
            }
            return invokeNext(message);
        }

        action.perform(message);
        log.debug("[{}] Message handled: severity={}", name, severity);
        return DispatchResult.handled(message, name);
    }

    @Override
    public void setNext(@Nullable LogHandler next) {
        this.next = next;
    }

    @Override
    public String toString() {
        return name + "[" + severity + "]";
    }
}
