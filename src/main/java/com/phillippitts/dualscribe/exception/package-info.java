/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.dualscribe.exception.DualScribeException} so the REST boundary can map
 * them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.dualscribe.exception.AcquisitionException} - audio device could not
 *       be opened</li>
 *   <li>{@link com.phillippitts.dualscribe.exception.UnsupportedFormatException} - audio cannot be
 *       normalized to canonical PCM</li>
 *   <li>{@link com.phillippitts.dualscribe.exception.RecognitionException} - recognizer failures;
 *       {@code AuthenticationException} is fatal, {@code ConnectivityException} is transient</li>
 *   <li>{@link com.phillippitts.dualscribe.exception.RecordingStartException} - aggregated start
 *       failure after rollback</li>
 *   <li>{@link com.phillippitts.dualscribe.exception.PersistenceException} - session file write
 *       failure, reported but never fatal</li>
 * </ul>
 *
 * @see com.phillippitts.dualscribe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.dualscribe.exception;
