package com.phillippitts.radflow.service.external.impl;

import com.phillippitts.radflow.config.properties.ExternalAppProperties;
import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.AWTException;
import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Drives the reporting application with {@link java.awt.Robot} keystrokes. Requires
 * Accessibility permission on macOS.
 *
 * <p>Window activation and focus restore have no portable Java API; they run optional
 * OS commands (for example {@code wmctrl -a Reporting} or an AppleScript one-liner)
 * configured under {@code external.*}.
 */
@Component
public class RobotExternalCommander implements ExternalCommander {

    private static final Logger LOG = LogManager.getLogger(RobotExternalCommander.class);

    private static final int[] MODIFIER_KEYS = {
            KeyEvent.VK_SHIFT, KeyEvent.VK_CONTROL, KeyEvent.VK_ALT, KeyEvent.VK_META
    };

    interface RobotFacade {
        void keyPress(int keyCode);
        void keyRelease(int keyCode);
    }

    static final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
            this.robot.setAutoDelay(10);
        }

        @Override
        public void keyPress(int keyCode) {
            robot.keyPress(keyCode);
        }

        @Override
        public void keyRelease(int keyCode) {
            robot.keyRelease(keyCode);
        }
    }

    /**
     * Runs an OS command with a timeout. Seam for tests.
     */
    interface CommandRunner {
        boolean run(List<String> command, Duration timeout);
    }

    static final class ProcessCommandRunner implements CommandRunner {
        @Override
        public boolean run(List<String> command, Duration timeout) {
            try {
                Process process = new ProcessBuilder(command)
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    LOG.warn("Command timed out after {}ms: {}", timeout.toMillis(), command.get(0));
                    return false;
                }
                return process.exitValue() == 0;
            } catch (IOException e) {
                LOG.warn("Command failed to start: {} ({})", command.get(0), e.toString());
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private final ExternalAppProperties props;
    private final RobotFacade robot;
    private final CommandRunner commands;

    @Autowired
    public RobotExternalCommander(ExternalAppProperties props) {
        this(props, createRobotFacade(), new ProcessCommandRunner());
    }

    // Package-private for tests
    RobotExternalCommander(ExternalAppProperties props, RobotFacade robot, CommandRunner commands) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.robot = robot; // null when input injection is unavailable (headless, no permission)
        this.commands = Objects.requireNonNull(commands, "commands must not be null");
    }

    private static RobotFacade createRobotFacade() {
        try {
            return new AwtRobotFacade();
        } catch (AWTException | RuntimeException e) {
            LOG.warn("Keystroke injection unavailable: {}", e.toString());
            return null;
        }
    }

    @Override
    public boolean emitKeystroke(ExternalCommand command) {
        String spec = props.getKeystrokes().get(command);
        if (spec == null || spec.isBlank()) {
            LOG.debug("No keystroke configured for {}", command);
            return false;
        }
        if (robot == null) {
            LOG.warn("Cannot send {} ({}): keystroke injection unavailable", command, spec);
            return false;
        }
        Keystroke keystroke;
        try {
            keystroke = Keystroke.parse(spec);
        } catch (IllegalArgumentException e) {
            LOG.warn("Invalid keystroke for {}: {}", command, e.getMessage());
            return false;
        }
        for (int mod : keystroke.modifierCodes()) {
            robot.keyPress(mod);
        }
        try {
            robot.keyPress(keystroke.keyCode());
            robot.keyRelease(keystroke.keyCode());
        } finally {
            List<Integer> mods = keystroke.modifierCodes();
            for (int i = mods.size() - 1; i >= 0; i--) {
                robot.keyRelease(mods.get(i));
            }
        }
        LOG.debug("Sent {} as {}", command, spec);
        return true;
    }

    @Override
    public void activateExternalApp() {
        runConfigured("activation", props.getActivationCommand());
    }

    @Override
    public void releaseModifiers() {
        if (robot == null) {
            return;
        }
        for (int key : MODIFIER_KEYS) {
            robot.keyRelease(key);
        }
    }

    @Override
    public void restorePreviousFocus() {
        runConfigured("focus-restore", props.getFocusRestoreCommand());
    }

    private void runConfigured(String purpose, List<String> command) {
        if (command == null || command.isEmpty()) {
            return;
        }
        boolean ok = commands.run(command, Duration.ofMillis(props.getCommandTimeoutMs()));
        if (!ok) {
            LOG.warn("{} command did not succeed", purpose);
        }
    }
}
