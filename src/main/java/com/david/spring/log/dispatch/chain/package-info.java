/**
 * Log handler chain of responsibility.
 *
 * <h2>Chain order</h2>
 * <pre>
 * LogMessage
 *     ↓
 * 1. FatalErrorHandler    - FATAL_ERROR: raises FatalLogMessageException
 *     ↓
 * 2. ErrorHandler         - ERROR: overwrites the error file
 *     ↓
 * 3. WarningHandler       - WARNING: writes to the diagnostic stream
 *     ↓
 * 4. UnclassifiedHandler  - UNCLASSIFIED: raises UnprocessedLogMessageException (optional)
 *     ↓
 * DROPPED
 * </pre>
 *
 * <h2>Core types</h2>
 * <ul>
 *   <li><b>LogHandler</b>: handler interface</li>
 *   <li><b>SeverityHandler</b>: handler built from a severity and a {@code LogAction}</li>
 *   <li><b>LogHandlerChain</b>: owns the order and wires successor links</li>
 *   <li><b>LogHandlerChainFactory</b>: builds the standard chain from configuration</li>
 *   <li><b>DispatchResult</b>: handled, dropped or failed</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * LogHandlerChain chain = chainFactory.createChain();
 *
 * chain.execute(LogMessage.warning("disk almost full"));
 *
 * DispatchResult result = chain.dispatch(LogMessage.fatalError("out of memory"));
 * if (result.isFailed()) {
 *     log.error(result.failure().getMessage());
 * }
 * }</pre>
 */
package com.david.spring.log.dispatch.chain;
