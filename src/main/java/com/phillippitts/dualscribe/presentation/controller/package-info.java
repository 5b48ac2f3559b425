/**
 * REST controllers for recording control, transcript queries and audio ingest.
 */
package com.phillippitts.dualscribe.presentation.controller;
