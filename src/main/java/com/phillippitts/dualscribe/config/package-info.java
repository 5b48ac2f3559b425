/**
 * Spring configuration: thread pools and wiring of the recording pipeline.
 *
 * <p>Typed property classes live in {@code config.properties}.
 */
package com.phillippitts.dualscribe.config;
