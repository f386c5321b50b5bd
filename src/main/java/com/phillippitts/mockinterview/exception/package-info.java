/**
 * Engine exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mockinterview.exception.MockInterviewException} - Base exception</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.ValidationException} - bad configuration or
 *       navigation argument, field-level, recoverable inline</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.PreflightFailureException} - mandatory check
 *       failed, blocks the interview from starting</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.NetworkException} - transient backend
 *       failure, retried with bounded backoff</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.FeedbackTimeoutException} - scoring is late;
 *       non-fatal</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.FatalSessionException} - backend rejected or
 *       lost the session; the session is aborted</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.UnauthorizedException} - missing or expired
 *       bearer credential</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.SessionStateException} - operation not legal
 *       in the current status</li>
 *   <li>{@link com.phillippitts.mockinterview.exception.SessionNotFoundException} - unknown handle</li>
 * </ul>
 *
 * <p>All exceptions map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.mockinterview.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.mockinterview.exception;
