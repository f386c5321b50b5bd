/**
 * Session lifecycle.
 *
 * <p>{@link com.phillippitts.mockinterview.service.session.SessionStateMachine} owns one session and
 * serializes every writer behind a single lock.
 * {@link com.phillippitts.mockinterview.service.session.InterviewSessionService} is the entry point:
 * it resolves sessions through the
 * {@link com.phillippitts.mockinterview.service.session.SessionRegistry} and performs the backend
 * I/O around each transition.
 */
package com.phillippitts.mockinterview.service.session;
