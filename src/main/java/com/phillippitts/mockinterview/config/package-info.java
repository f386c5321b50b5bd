/**
 * Spring configuration: thread pools, backend HTTP client and typed properties.
 *
 * <p>Typed properties live in {@link com.phillippitts.mockinterview.config.properties} and are
 * validated at startup so misconfiguration fails fast.
 *
 * @since 1.0
 */
package com.phillippitts.mockinterview.config;
