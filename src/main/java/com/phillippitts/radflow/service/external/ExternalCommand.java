package com.phillippitts.radflow.service.external;

/**
 * Commands sent to the reporting application.
 */
public enum ExternalCommand {
    TOGGLE_DICTATION,
    PROCESS_REPORT,
    SIGN_REPORT,
    DISCARD_STUDY,
    CREATE_IMPRESSION,
    CREATE_CRITICAL_NOTE,
    PASTE,
    PAGE_DOWN
}
