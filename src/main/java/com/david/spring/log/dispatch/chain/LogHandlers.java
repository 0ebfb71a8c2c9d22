package com.david.spring.log.dispatch.chain;

import com.david.spring.log.dispatch.chain.action.ErrorFileAction;
import com.david.spring.log.dispatch.chain.action.FatalErrorAction;
import com.david.spring.log.dispatch.chain.action.UnprocessedMessageAction;
import com.david.spring.log.dispatch.chain.action.WarningStreamAction;
import com.david.spring.log.dispatch.model.Severity;

import java.io.PrintStream;
import java.nio.file.Path;

/** Factory methods for the standard handlers. Each call returns a new, unlinked instance. */
public final class LogHandlers {

    public static final String FATAL_ERROR_HANDLER = "FatalErrorHandler";
    public static final String ERROR_HANDLER = "ErrorHandler";
    public static final String WARNING_HANDLER = "WarningHandler";
    public static final String UNCLASSIFIED_HANDLER = "UnclassifiedHandler";

    private LogHandlers() {
    }

    public static SeverityHandler fatalError() {
        return new SeverityHandler(FATAL_ERROR_HANDLER, Severity.FATAL_ERROR, new FatalErrorAction());
    }

    /** Truncates {@code errorFile} immediately. */
    public static SeverityHandler error(Path errorFile) {
        return new SeverityHandler(ERROR_HANDLER, Severity.ERROR, new ErrorFileAction(errorFile));
    }

    public static SeverityHandler warning(PrintStream diagnosticStream) {
        return new SeverityHandler(WARNING_HANDLER, Severity.WARNING, new WarningStreamAction(diagnosticStream));
    }

    public static SeverityHandler unclassified() {
        return new SeverityHandler(UNCLASSIFIED_HANDLER, Severity.UNCLASSIFIED, new UnprocessedMessageAction());
    }
}
