package com.david.spring.log.dispatch.chain;

import com.david.spring.log.dispatch.config.LogDispatchProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.util.Assert;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Log handler chain factory.
 *
 * <p>Chain order: 1. FatalErrorHandler - abort 2. ErrorHandler - overwrite error file
 * 3. WarningHandler - diagnostic stream 4. UnclassifiedHandler - catch-all, optional
 */
@Slf4j
@RequiredArgsConstructor
public class LogHandlerChainFactory {

    private final LogDispatchProperties properties;

    private final PrintStream diagnosticStream;

    /**
     * Create the standard chain, including the catch-all unless disabled by configuration.
     *
     * @return a new chain with fresh handler instances
     */
    public LogHandlerChain createChain() {
        return createChain(properties.isCatchAll());
    }

    /**
     * Create the standard chain.
     *
     * @param includeCatchAll whether to append the catch-all handler
     * @return a new chain with fresh handler instances
     */
    public LogHandlerChain createChain(boolean includeCatchAll) {
        Assert.hasText(properties.getErrorFile(), "Property 'log.dispatch.error-file' must be configured");
        Path errorFile = Path.of(properties.getErrorFile());

        LogHandlerChain chain = new LogHandlerChain();
        chain.addHandler(LogHandlers.fatalError())
                .addHandler(LogHandlers.error(errorFile))
                .addHandler(LogHandlers.warning(diagnosticStream));
        if (includeCatchAll) {
            chain.addHandler(LogHandlers.unclassified());
        }

        log.info(
                "Log handler chain created with {} handlers: {}, errorFile={}",
                chain.size(),
                chain.getHandlerNames(),
                errorFile);

        return chain;
    }
}
