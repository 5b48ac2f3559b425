/**
 * Service layer.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.audio} - canonical PCM format, sample conversion, per-stream capture sources</li>
 *   <li>{@code service.recognition} - streaming recognition sessions and recognizer clients (Vosk, remote)</li>
 *   <li>{@code service.orchestration} - atomic start/stop of all streams, single-writer routing, reconnects</li>
 *   <li>{@code service.transcript} - deduplicated transcript log, export and session persistence</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - observability</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (not HTTP exceptions).
 */
package com.phillippitts.dualscribe.service;
