package com.phillippitts.dualscribe.service.recognition;

import com.phillippitts.dualscribe.domain.StreamId;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to an external streaming recognition capability.
 *
 * <p>Implementations fail the returned future with
 * {@link com.phillippitts.dualscribe.exception.AuthenticationException} or
 * {@link com.phillippitts.dualscribe.exception.ConnectivityException}; callers bound the wait.
 */
public interface RecognitionClient extends AutoCloseable {

    /** Short provider name used in logs and metrics tags. */
    String name();

    CompletableFuture<RecognitionHandle> open(StreamId streamId, LanguageConfig language, RecognitionListener listener);

    /**
     * Cheap readiness probe used by health reporting; must not open a connection.
     */
    default boolean isAvailable() {
        return true;
    }

    /** Releases provider-wide resources such as a loaded model. */
    @Override
    default void close() {
    }
}
