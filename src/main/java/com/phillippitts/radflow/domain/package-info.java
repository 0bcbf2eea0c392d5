/**
 * Immutable value types shared across the action queue, the pollers and the REST surface.
 */
package com.phillippitts.radflow.domain;
