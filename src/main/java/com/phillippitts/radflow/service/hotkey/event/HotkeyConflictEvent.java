package com.phillippitts.radflow.service.hotkey.event;

import com.phillippitts.radflow.domain.ActionKind;

import java.time.Instant;

/**
 * Published when a bound hotkey collides with a reserved shortcut (an OS shortcut or one
 * the reporting app uses itself) or with another binding.
 */
public record HotkeyConflictEvent(ActionKind action, String hotkey, String conflictsWith, Instant at) { }
