/**
 * Remote recognition provider speaking a small JSON + binary PCM protocol over a WebSocket.
 */
package com.phillippitts.dualscribe.service.recognition.remote;
