/**
 * Immutable domain values for the mock interview engine.
 *
 * <p>Everything here is a record or an enum. The mutable session aggregate lives with the engine in
 * {@link com.phillippitts.mockinterview.service.session}, where its writers are serialized.
 *
 * @since 1.0
 */
package com.phillippitts.mockinterview.domain;
