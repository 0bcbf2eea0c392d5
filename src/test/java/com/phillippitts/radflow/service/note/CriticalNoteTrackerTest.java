package com.phillippitts.radflow.service.note;

import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.testutil.RecordingCommander;
import com.phillippitts.radflow.testutil.RecordingPresentationSurface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CriticalNoteTrackerTest {

    private RecordingCommander commander;
    private RecordingPresentationSurface presentation;
    private CriticalNoteTracker tracker;

    @BeforeEach
    void setUp() {
        commander = new RecordingCommander();
        presentation = new RecordingPresentationSurface();
        tracker = new CriticalNoteTracker(commander, presentation);
    }

    @Test
    void createsNoteOncePerAccession() {
        // Act
        boolean first = tracker.ensureNoteForAccession("ACC1");
        boolean second = tracker.ensureNoteForAccession("ACC1");

        // Assert
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(commander.count(ExternalCommand.CREATE_CRITICAL_NOTE)).isEqualTo(1);
        assertThat(presentation.toasts()).containsExactly("Critical note created");
        assertThat(tracker.hasCriticalNoteFor("ACC1")).isTrue();
    }

    @Test
    void failedAttemptIsNotRecordedAndCanBeRetried() {
        // Arrange
        commander.fail(ExternalCommand.CREATE_CRITICAL_NOTE);

        // Act
        boolean failed = tracker.ensureNoteForAccession("ACC1");
        commander.recover(ExternalCommand.CREATE_CRITICAL_NOTE);
        boolean retried = tracker.ensureNoteForAccession("ACC1");

        // Assert
        assertThat(failed).isFalse();
        assertThat(retried).isTrue();
        assertThat(presentation.toasts())
                .containsExactly("Critical note failed - create manually", "Critical note created");
    }

    @Test
    void blankAccessionIsIgnored() {
        assertThat(tracker.ensureNoteForAccession(null)).isFalse();
        assertThat(tracker.ensureNoteForAccession(" ")).isFalse();
        assertThat(commander.emitted()).isEmpty();
        assertThat(tracker.hasCriticalNoteFor(null)).isFalse();
    }

    @Test
    void resetForgetsRecordedAccession() {
        // Arrange
        tracker.ensureNoteForAccession("ACC1");

        // Act
        tracker.reset();

        // Assert
        assertThat(tracker.hasCriticalNoteFor("ACC1")).isFalse();
        assertThat(tracker.ensureNoteForAccession("ACC1")).isTrue();
    }

    @Test
    void newAccessionReplacesPreviousOne() {
        // Act
        tracker.ensureNoteForAccession("ACC1");
        tracker.ensureNoteForAccession("ACC2");

        // Assert
        assertThat(tracker.hasCriticalNoteFor("ACC1")).isFalse();
        assertThat(tracker.hasCriticalNoteFor("ACC2")).isTrue();
    }
}
