/**
 * Audio sources: Java Sound devices and host-pushed audio, both normalized to canonical PCM and
 * delivered through a bounded drop-oldest queue.
 */
package com.phillippitts.dualscribe.service.audio.capture;
