/**
 * Recording lifecycle events.
 */
package com.phillippitts.dualscribe.service.orchestration.event;
