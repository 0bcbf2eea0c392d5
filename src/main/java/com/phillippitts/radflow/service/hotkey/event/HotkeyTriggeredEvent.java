package com.phillippitts.radflow.service.hotkey.event;

import com.phillippitts.radflow.domain.ActionKind;

import java.time.Instant;

/**
 * Published when the hotkey bound to {@code action} is pressed.
 */
public record HotkeyTriggeredEvent(ActionKind action, Instant at) { }
