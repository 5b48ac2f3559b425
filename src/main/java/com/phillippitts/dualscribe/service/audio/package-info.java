/**
 * Canonical audio format constants and sample conversion.
 *
 * <p>Everything downstream of capture sees 16 kHz, 16-bit signed, mono, little-endian PCM.
 */
package com.phillippitts.dualscribe.service.audio;
