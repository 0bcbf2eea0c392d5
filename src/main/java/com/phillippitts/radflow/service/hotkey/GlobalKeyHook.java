package com.phillippitts.radflow.service.hotkey;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard hook (JNativeHook in production).
 *
 * Tests inject a fake and feed {@link NormalizedKeyEvent}s to the registered listener.
 */
public interface GlobalKeyHook {

    /** Register the global hook. Idempotent. */
    void register();

    /** Unregister the global hook. Idempotent. */
    void unregister();

    void addListener(Consumer<NormalizedKeyEvent> listener);
}
