package com.phillippitts.radflow.presentation.controller;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.presentation.dto.ActionCommand;
import com.phillippitts.radflow.presentation.dto.PickListSelectionRequest;
import com.phillippitts.radflow.service.dictation.DictationStateReconciler;
import com.phillippitts.radflow.service.events.StudyEventBroadcaster;
import com.phillippitts.radflow.service.insert.ClipboardPasteService;
import com.phillippitts.radflow.service.note.CriticalNoteTracker;
import com.phillippitts.radflow.service.queue.ActionQueue;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import com.phillippitts.radflow.service.study.ImpressionSearch;
import com.phillippitts.radflow.testutil.EventCapturingPublisher;
import com.phillippitts.radflow.testutil.MutableClock;
import com.phillippitts.radflow.testutil.RecordingCommander;
import com.phillippitts.radflow.testutil.RecordingPresentationSurface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrchestrationControllerTest {

    private ActionQueue queue;
    private CaseContextTracker cases;
    private CriticalNoteTracker notes;
    private DictationStateReconciler reconciler;
    private ClipboardPasteService pasteService;
    private MutableClock clock;
    private ImpressionSearch impressionSearch;
    private OrchestrationController controller;

    @BeforeEach
    void setUp() {
        queue = mock(ActionQueue.class);
        cases = new CaseContextTracker();
        RecordingPresentationSurface presentation = new RecordingPresentationSurface();
        notes = new CriticalNoteTracker(new RecordingCommander(), presentation);
        reconciler = mock(DictationStateReconciler.class);
        pasteService = mock(ClipboardPasteService.class);
        clock = new MutableClock();
        impressionSearch = new ImpressionSearch(clock, new EventCapturingPublisher());
        controller = new OrchestrationController(queue, cases, notes, reconciler, impressionSearch,
                pasteService, presentation, mock(StudyEventBroadcaster.class));
    }

    @Test
    void enqueuesBindableActionByName() {
        // Arrange
        when(queue.depth()).thenReturn(1);

        // Act
        ResponseEntity<Map<String, Object>> response = controller.enqueue(new ActionCommand("sign report", null));

        // Assert
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody()).containsEntry("queued", "SIGN_REPORT").containsEntry("queueDepth", 1);
        verify(queue).enqueue(ActionRequest.of(ActionKind.SIGN_REPORT, ActionSources.API));
    }

    @Test
    void rejectsUnknownAndInternalActions() {
        assertThatThrownBy(() -> controller.enqueue(new ActionCommand("FLY", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown action");
        assertThatThrownBy(() -> controller.enqueue(new ActionCommand("INSERT_MACROS", "Api")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be requested directly");
    }

    @Test
    void pickListSelectionIsEncodedAsPayload() {
        // Act
        controller.selectPickListItem(new PickListSelectionRequest("Chest", 2));

        // Assert
        verify(queue).enqueue(new ActionRequest(ActionKind.INSERT_PICK_LIST_TEXT, ActionSources.API, "Chest#2"));
    }

    @Test
    void statusReportsLiveCase() {
        // Arrange
        cases.observe("ACC1");
        notes.ensureNoteForAccession("ACC1");
        when(reconciler.isRecording()).thenReturn(true);

        // Act
        Map<String, Object> body = controller.status().getBody();

        // Assert
        assertThat(body)
                .containsEntry("isCaseOpen", true)
                .containsEntry("currentAccession", "ACC1")
                .containsEntry("hasCriticalNote", true)
                .containsEntry("recording", true)
                .containsEntry("impressionMode", "IDLE");
    }

    @Test
    void statusWithNoCaseOpen() {
        // Act
        Map<String, Object> body = controller.status().getBody();

        // Assert
        assertThat(body).containsEntry("isCaseOpen", false).containsEntry("hasCriticalNote", false);
        assertThat(body.get("currentAccession")).isNull();
        assertThat(body).containsEntry("impressionSearchActive", false);
        assertThat(body.get("impressionSearchStartedAt")).isNull();
        assertThat(body.get("lastPasteAt")).isNull();
    }

    @Test
    void statusReportsImpressionSearchAndLastPaste() {
        // Arrange
        Instant pastedAt = Instant.parse("2024-05-01T07:59:00Z");
        when(pasteService.lastPasteAt()).thenReturn(pastedAt);
        impressionSearch.begin();

        // Act
        Map<String, Object> body = controller.status().getBody();

        // Assert
        assertThat(body)
                .containsEntry("impressionMode", "FAST")
                .containsEntry("impressionSearchActive", true)
                .containsEntry("impressionSearchStartedAt", clock.instant())
                .containsEntry("lastPasteAt", pastedAt);
    }
}
