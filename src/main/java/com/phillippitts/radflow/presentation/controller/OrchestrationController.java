package com.phillippitts.radflow.presentation.controller;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.presentation.dto.ActionCommand;
import com.phillippitts.radflow.presentation.dto.PickListSelectionRequest;
import com.phillippitts.radflow.service.dictation.DictationStateReconciler;
import com.phillippitts.radflow.service.events.StudyEventBroadcaster;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.insert.ClipboardPasteService;
import com.phillippitts.radflow.service.insert.PickListSelection;
import com.phillippitts.radflow.service.note.CriticalNoteTracker;
import com.phillippitts.radflow.service.queue.ActionQueue;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import com.phillippitts.radflow.service.study.ImpressionSearch;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Enqueues actions and reports orchestration state.
 */
@RestController
@RequestMapping("/api")
class OrchestrationController {

    private static final Logger LOG = LogManager.getLogger(OrchestrationController.class);

    private final ActionQueue queue;
    private final CaseContextTracker cases;
    private final CriticalNoteTracker notes;
    private final DictationStateReconciler reconciler;
    private final ImpressionSearch impressionSearch;
    private final ClipboardPasteService pasteService;
    private final PresentationSurface presentation;
    private final StudyEventBroadcaster studyEvents;

    OrchestrationController(ActionQueue queue,
                            CaseContextTracker cases,
                            CriticalNoteTracker notes,
                            DictationStateReconciler reconciler,
                            ImpressionSearch impressionSearch,
                            ClipboardPasteService pasteService,
                            PresentationSurface presentation,
                            StudyEventBroadcaster studyEvents) {
        this.queue = queue;
        this.cases = cases;
        this.notes = notes;
        this.reconciler = reconciler;
        this.impressionSearch = impressionSearch;
        this.pasteService = pasteService;
        this.presentation = presentation;
        this.studyEvents = studyEvents;
    }

    /**
     * Enqueues a bindable action. Internal-only kinds are rejected with 400.
     */
    @PostMapping("/actions")
    ResponseEntity<Map<String, Object>> enqueue(@Valid @RequestBody ActionCommand command) {
        ActionKind kind = parseKind(command.action());
        if (!kind.isBindable()) {
            throw new IllegalArgumentException("Action " + kind + " cannot be requested directly");
        }
        String source = command.source() == null || command.source().isBlank() ? ActionSources.API : command.source();
        queue.enqueue(ActionRequest.of(kind, source));
        LOG.info("Action {} requested via API from {}", kind, source);
        return ResponseEntity.accepted().body(Map.of("queued", kind.name(), "queueDepth", queue.depth()));
    }

    @PostMapping("/pick-lists/selection")
    ResponseEntity<Map<String, Object>> selectPickListItem(@Valid @RequestBody PickListSelectionRequest request) {
        PickListSelection selection = new PickListSelection(request.list(), request.index());
        queue.enqueue(new ActionRequest(ActionKind.INSERT_PICK_LIST_TEXT, ActionSources.API, selection.encode()));
        return ResponseEntity.accepted().body(Map.of("queued", selection.encode()));
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        String accession = cases.currentAccession();
        body.put("isCaseOpen", accession != null);
        body.put("currentAccession", accession);
        body.put("hasCriticalNote", notes.hasCriticalNoteFor(accession));
        body.put("recording", reconciler.isRecording());
        body.put("busy", queue.isBusy());
        body.put("queueDepth", queue.depth());
        body.put("impressionMode", impressionSearch.mode().name());
        body.put("impressionSearchActive", impressionSearch.isActive());
        body.put("impressionSearchStartedAt", impressionSearch.startedAt());
        body.put("lastPasteAt", pasteService.lastPasteAt());
        body.put("presentation", presentation.describe());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/notes")
    ResponseEntity<Map<String, Object>> hasCriticalNote(@RequestParam String accession) {
        return ResponseEntity.ok(Map.of("accession", accession, "hasCriticalNote", notes.hasCriticalNoteFor(accession)));
    }

    @GetMapping(value = "/study-events", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> studyEvents() {
        return ResponseEntity.ok(studyEvents.recentAsJson());
    }

    private static ActionKind parseKind(String name) {
        try {
            return ActionKind.valueOf(name.trim().toUpperCase(Locale.ROOT).replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + name, e);
        }
    }
}
