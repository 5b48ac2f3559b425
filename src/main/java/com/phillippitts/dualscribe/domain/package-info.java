/**
 * Domain model for dual-stream transcription.
 *
 * <p>All types are immutable value objects (Java records or enums). The stream to speaker
 * mapping is fixed by {@link com.phillippitts.dualscribe.domain.StreamId}; transcripts are created
 * only by the transcript engine.
 *
 * @since 1.0
 */
package com.phillippitts.dualscribe.domain;
