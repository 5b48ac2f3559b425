/**
 * Application-wide listeners for error events raised by capture, recognition and persistence.
 */
package com.phillippitts.dualscribe.service.events;
