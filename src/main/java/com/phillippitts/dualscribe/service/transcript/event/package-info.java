/**
 * Spring application events published by the transcript engine.
 */
package com.phillippitts.dualscribe.service.transcript.event;
