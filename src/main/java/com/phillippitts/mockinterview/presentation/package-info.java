/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over the session engine. Exception handlers map engine
 * exceptions to HTTP status codes; controllers never throw HTTP-specific exceptions.
 *
 * @see com.phillippitts.mockinterview.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.mockinterview.presentation;
