/**
 * Local recognition provider on the Vosk offline speech library.
 */
package com.phillippitts.dualscribe.service.recognition.vosk;
