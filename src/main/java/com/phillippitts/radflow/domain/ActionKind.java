package com.phillippitts.radflow.domain;

/**
 * Actions the worker can execute. Bindable kinds can be mapped to hotkeys and device buttons;
 * the others are only requested internally.
 */
public enum ActionKind {
    SYSTEM_BEEP("System Beep", true),
    TOGGLE_RECORDING("Toggle Recording", true),
    START_RECORDING("Start Recording", false),
    STOP_RECORDING("Stop Recording", false),
    PROCESS_REPORT("Process Report", true),
    SIGN_REPORT("Sign Report", true),
    DISCARD_STUDY("Discard Study", true),
    CREATE_IMPRESSION("Create Impression", true),
    SHOW_REPORT("Show Report", true),
    SHOW_PICK_LISTS("Show Pick Lists", true),
    INSERT_PICK_LIST_TEXT("Insert Pick List Text", false),
    INSERT_MACROS("Insert Macros", false),
    CREATE_CRITICAL_NOTE("Create Critical Note", true);

    private final String displayName;
    private final boolean bindable;

    ActionKind(String displayName, boolean bindable) {
        this.displayName = displayName;
        this.bindable = bindable;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isBindable() {
        return bindable;
    }
}
