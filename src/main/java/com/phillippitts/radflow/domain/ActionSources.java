package com.phillippitts.radflow.domain;

/**
 * Well-known {@link ActionRequest#source()} values. Device button names match the
 * names reported by the dictation microphone bridge.
 */
public final class ActionSources {

    public static final String HOTKEY = "Hotkey";
    public static final String API = "Api";
    public static final String INTERNAL = "Internal";
    public static final String RECORD_BUTTON = "Record Button";

    /** Device button that the reporting app itself maps to "process". */
    public static final String SKIP_BACK = "Skip Back";
    /** Device button that the reporting app itself maps to "create impression". */
    public static final String SKIP_FORWARD = "Skip Forward";
    /** Device button that the reporting app itself maps to "sign". */
    public static final String CHECKMARK = "Checkmark";

    private ActionSources() {}
}
