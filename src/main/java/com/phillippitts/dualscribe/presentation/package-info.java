/**
 * HTTP surface of the service.
 */
package com.phillippitts.dualscribe.presentation;
