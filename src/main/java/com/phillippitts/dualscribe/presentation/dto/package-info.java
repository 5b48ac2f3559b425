/**
 * Request bodies of the REST API.
 */
package com.phillippitts.dualscribe.presentation.dto;
