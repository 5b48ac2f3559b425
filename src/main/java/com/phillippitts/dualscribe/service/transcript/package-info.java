/**
 * Transcript engine: the bounded, deduplicated transcript log of the active session.
 *
 * <p>{@link com.phillippitts.dualscribe.service.transcript.DefaultTranscriptEngine} combines the
 * {@link com.phillippitts.dualscribe.service.transcript.TranscriptLog},
 * {@link com.phillippitts.dualscribe.service.transcript.DuplicateSuppressor} and
 * {@link com.phillippitts.dualscribe.service.transcript.SessionStore}. Consumers observe it
 * through the events in the {@code event} subpackage and the query methods of
 * {@link com.phillippitts.dualscribe.service.transcript.TranscriptEngine}.
 */
package com.phillippitts.dualscribe.service.transcript;
