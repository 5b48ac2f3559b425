/**
 * Recording orchestration: supervises the capture/recognition pair of each stream as one atomic
 * recording and routes frames and results through a single-writer loop.
 *
 * <p>Entry point is {@link com.phillippitts.dualscribe.service.orchestration.RecordingOrchestrator}.
 */
package com.phillippitts.dualscribe.service.orchestration;
