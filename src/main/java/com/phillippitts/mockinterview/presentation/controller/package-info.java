/**
 * REST API controllers.
 *
 * <p>Endpoints under {@code /api/v1/mock-interviews}:
 * <ul>
 *   <li>{@code POST /} configure a session; {@code POST /resume/{sessionId}} resume after reload</li>
 *   <li>{@code GET /{handle}} session view</li>
 *   <li>{@code POST /{handle}/capabilities}, {@code POST /{handle}/preflight},
 *       {@code POST /{handle}/preflight/{check}/retry}</li>
 *   <li>{@code PUT /{handle}/answers/{index}} and {@code .../voice}</li>
 *   <li>{@code POST /{handle}/navigation}, {@code /finish}, {@code /abort}, {@code /signals}</li>
 *   <li>{@code GET /{handle}/summary}</li>
 * </ul>
 */
package com.phillippitts.mockinterview.presentation.controller;
