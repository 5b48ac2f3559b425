/**
 * Micrometer instrumentation.
 */
package com.phillippitts.dualscribe.service.metrics;
