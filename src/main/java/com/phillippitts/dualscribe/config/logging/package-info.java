/**
 * Logging support: MDC population for HTTP requests.
 */
package com.phillippitts.dualscribe.config.logging;
