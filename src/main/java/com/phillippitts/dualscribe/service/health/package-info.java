/**
 * Actuator health indicators.
 */
package com.phillippitts.dualscribe.service.health;
