package com.david.spring.log.dispatch.chain;

import com.david.spring.log.dispatch.event.DispatchListener;
import com.david.spring.log.dispatch.exception.LogDispatchException;
import com.david.spring.log.dispatch.model.LogMessage;
import com.david.spring.log.dispatch.model.Severity;

import jakarta.annotation.Nullable;

import lombok.extern.slf4j.Slf4j;

import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered log handler chain.
 * <p>
 * The chain owns the handler order and each handler instance appears at most
 * once. Dispatch walks that list and hands the message to the first handler
 * claiming its severity; successor links are rewired from the list on every
 * change for the {@link LogHandler} contract, but dispatch never follows them,
 * so a link changed elsewhere cannot reroute or loop this chain.
 * </p>
 * <p>
 * Not thread-safe: handlers hold no synchronisation and the error file is
 * overwritten on every call. Callers sharing one chain across threads must
 * serialise {@link #execute} and {@link #dispatch} themselves.
 * </p>
 */
@Slf4j
public class LogHandlerChain {

    /** Handlers in dispatch order */
    private final List<LogHandler> handlers = new ArrayList<>();

    private final List<DispatchListener> listeners = new ArrayList<>();

    /**
     * Append a handler to the end of the chain.
     *
     * @param handler the handler; its current successor is cleared
     * @return this chain
     * @throws IllegalArgumentException if the same instance is already in the chain
     */
    public LogHandlerChain addHandler(LogHandler handler) {
        Assert.notNull(handler, "Handler must not be null");
        Assert.isTrue(indexOf(handler) < 0, () -> "Handler already present in chain: " + handler.getName());

        handler.setNext(null);
        if (!handlers.isEmpty()) {
            handlers.get(handlers.size() - 1).setNext(handler);
        }
        handlers.add(handler);
        log.debug("Added handler to chain: {}", handler.getName());
        return this;
    }

    /**
     * Remove a handler and link its predecessor to its successor.
     *
     * @return true if the handler was part of the chain
     */
    public boolean removeHandler(LogHandler handler) {
        int index = indexOf(handler);
        if (index < 0) {
            return false;
        }
        handlers.remove(index);
        handler.setNext(null);
        if (index > 0) {
            handlers.get(index - 1).setNext(index < handlers.size() ? handlers.get(index) : null);
        }
        log.debug("Removed handler from chain: {}", handler.getName());
        return true;
    }

    /**
     * Remove every handler claiming the given severity.
     *
     * @return number of handlers removed
     */
    public int removeHandlers(Severity severity) {
        List<LogHandler> matching = handlers.stream()
                .filter(handler -> handler.getSeverity() == severity)
                .toList();
        matching.forEach(this::removeHandler);
        return matching.size();
    }

    /**
     * Dispatch a message to the first handler, in chain order, claiming its severity.
     *
     * @param message the message
     * @return {@link DispatchOutcome#HANDLED} or {@link DispatchOutcome#DROPPED}
     * @throws LogDispatchException when a terminal handler claims the message
     */
    public DispatchResult execute(LogMessage message) {
        Assert.notNull(message, "Log message must not be null");

        if (handlers.isEmpty()) {
            log.warn("Log handler chain is empty, dropping message: severity={}", message.severity());
            return publish(DispatchResult.dropped(message));
        }

        log.debug("Executing handler chain: severity={}, handlers={}", message.severity(), handlers.size());
        LogHandler handler = findHandler(message.severity());
        if (handler == null) {
            log.debug("End of chain reached, dropping message: severity={}", message.severity());
            return publish(DispatchResult.dropped(message));
        }
        try {
            return publish(handler.handle(message));
        } catch (LogDispatchException e) {
            publish(DispatchResult.failed(message, e));
            throw e;
        }
    }

    /**
     * Dispatch a message, reporting hard failures as a result instead of raising.
     *
     * @param message the message
     * @return the dispatch result; {@link DispatchOutcome#FAILED} carries the failure
     */
    public DispatchResult dispatch(LogMessage message) {
        try {
            return execute(message);
        } catch (LogDispatchException e) {
            log.debug("Dispatch ended with hard failure: severity={}, reason={}", message.severity(), e.getMessage());
            return DispatchResult.failed(message, e);
        }
    }

    public void addListener(DispatchListener listener) {
        Assert.notNull(listener, "Listener must not be null");
        listeners.add(listener);
        log.debug("Registered dispatch listener: {}", listener.getClass().getSimpleName());
    }

    public boolean removeListener(DispatchListener listener) {
        return listeners.remove(listener);
    }

    @Nullable
    public LogHandler getHead() {
        return handlers.isEmpty() ? null : handlers.get(0);
    }

    public List<LogHandler> getHandlers() {
        return Collections.unmodifiableList(handlers);
    }

    public List<String> getHandlerNames() {
        return handlers.stream().map(LogHandler::getName).toList();
    }

    public List<Severity> getSeverities() {
        return handlers.stream().map(LogHandler::getSeverity).toList();
    }

    public int size() {
        return handlers.size();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    /** Unlink and remove all handlers. Listeners stay registered. */
    public void clear() {
        handlers.forEach(handler -> handler.setNext(null));
        handlers.clear();
        log.debug("Log handler chain cleared");
    }

    @Nullable
    private LogHandler findHandler(Severity severity) {
        for (LogHandler handler : handlers) {
            if (handler.getSeverity() == severity) {
                return handler;
            }
        }
        return null;
    }

    private int indexOf(LogHandler handler) {
        for (int i = 0; i < handlers.size(); i++) {
            if (handlers.get(i) == handler) {
                return i;
            }
        }
        return -1;
    }

    private DispatchResult publish(DispatchResult result) {
        for (DispatchListener listener : listeners) {
            try {
                listener.onDispatch(result);
            } catch (Exception e) {
                log.warn("Error processing dispatch result by listener {}: {}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
        return result;
    }
}
