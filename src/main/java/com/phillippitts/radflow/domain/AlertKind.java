package com.phillippitts.radflow.domain;

/**
 * Alert conditions in presentation priority order (highest first).
 */
public enum AlertKind {
    GENDER_MISMATCH,
    TEMPLATE_MISMATCH,
    PROTOCOL_FLAG
}
