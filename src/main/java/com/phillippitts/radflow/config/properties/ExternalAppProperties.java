package com.phillippitts.radflow.config.properties;

import com.phillippitts.radflow.service.external.ExternalCommand;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * How the default collaborators reach the reporting application: keystrokes per command,
 * optional OS commands for window activation and focus restore, and staleness of pushed
 * oracle readings.
 */
@ConfigurationProperties(prefix = "external")
@Validated
public class ExternalAppProperties {

    /**
     * Keystroke per command, e.g. {@code alt+r}. A blank keystroke means the command is
     * not available and reports failure.
     */
    private Map<ExternalCommand, String> keystrokes = defaultKeystrokes();

    /** Command line that brings the reporting app to the foreground. Empty = no-op. */
    private List<String> activationCommand = new ArrayList<>();

    /** Command line that restores the previously focused window. Empty = no-op. */
    private List<String> focusRestoreCommand = new ArrayList<>();

    @Positive
    private long commandTimeoutMs = 2000;

    /** Pushed oracle readings older than this read as unknown. */
    @Positive
    private long oracleStalenessMs = 5000;

    private static Map<ExternalCommand, String> defaultKeystrokes() {
        Map<ExternalCommand, String> map = new EnumMap<>(ExternalCommand.class);
        map.put(ExternalCommand.TOGGLE_DICTATION, "alt+r");
        map.put(ExternalCommand.PROCESS_REPORT, "alt+p");
        map.put(ExternalCommand.SIGN_REPORT, "alt+f");
        map.put(ExternalCommand.PASTE, "ctrl+v");
        map.put(ExternalCommand.PAGE_DOWN, "page_down");
        return map;
    }

    public Map<ExternalCommand, String> getKeystrokes() {
        return keystrokes;
    }

    public void setKeystrokes(Map<ExternalCommand, String> keystrokes) {
        this.keystrokes = keystrokes;
    }

    public List<String> getActivationCommand() {
        return activationCommand;
    }

    public void setActivationCommand(List<String> activationCommand) {
        this.activationCommand = activationCommand;
    }

    public List<String> getFocusRestoreCommand() {
        return focusRestoreCommand;
    }

    public void setFocusRestoreCommand(List<String> focusRestoreCommand) {
        this.focusRestoreCommand = focusRestoreCommand;
    }

    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    public void setCommandTimeoutMs(long commandTimeoutMs) {
        this.commandTimeoutMs = commandTimeoutMs;
    }

    public long getOracleStalenessMs() {
        return oracleStalenessMs;
    }

    public void setOracleStalenessMs(long oracleStalenessMs) {
        this.oracleStalenessMs = oracleStalenessMs;
    }
}
