/**
 * Logging configuration and MDC (ThreadContext) helpers.
 *
 * <p>HTTP requests get a {@code requestId}; scheduler and worker tasks get the {@code sessionId}
 * of the session they act on. Both keys are rendered by the console pattern in
 * {@code log4j2-spring.xml}.
 */
package com.phillippitts.mockinterview.config.logging;
