/**
 * Streaming recognition: the provider SPI ({@link com.phillippitts.dualscribe.service.recognition.RecognitionClient})
 * and the per-stream session state machine that wraps it.
 *
 * <p>Providers live in sub-packages: {@code vosk} (local model) and {@code remote} (websocket).
 */
package com.phillippitts.dualscribe.service.recognition;
