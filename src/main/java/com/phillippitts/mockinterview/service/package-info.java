/**
 * The mock interview session engine.
 *
 * <p>Leaves first: {@code configurator}, {@code preflight}, {@code timer}, {@code integrity},
 * {@code answer}; then {@code session}, which orchestrates them into the lifecycle, followed by
 * {@code feedback} and {@code scoring} after completion. {@code backend} is the REST collaborator.
 *
 * <p>Background work (countdown ticks, integrity evaluations, feedback polls, completion retries)
 * shares one scheduler. Cancelled tasks leave its queue immediately.
 *
 * @since 1.0
 */
package com.phillippitts.mockinterview.service;
