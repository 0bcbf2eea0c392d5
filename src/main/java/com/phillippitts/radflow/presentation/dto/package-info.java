/**
 * Request bodies for the REST endpoints.
 */
package com.phillippitts.radflow.presentation.dto;
