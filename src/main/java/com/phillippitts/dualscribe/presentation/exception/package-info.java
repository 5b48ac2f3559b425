/**
 * REST error mapping.
 */
package com.phillippitts.dualscribe.presentation.exception;
