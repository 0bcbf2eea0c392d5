package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.TerminalOutcome;
import com.phillippitts.radflow.service.external.ExternalCommand;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.note.CriticalNoteTracker;
import com.phillippitts.radflow.service.queue.ActionHandler;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import com.phillippitts.radflow.service.study.ImpressionSearch;
import com.phillippitts.radflow.service.study.event.CaseTerminatedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Discards the open study. On success the case is closed right away with a
 * closed-unsigned notification, so the poller does not report it again when the
 * accession disappears.
 */
@Component
class DiscardStudyHandler implements ActionHandler {

    private static final Logger LOG = LogManager.getLogger(DiscardStudyHandler.class);
    static final int TOAST_MS = 2000;

    private final ExternalCommander commander;
    private final PresentationSurface presentation;
    private final CaseContextTracker cases;
    private final CriticalNoteTracker notes;
    private final ImpressionSearch impressionSearch;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    DiscardStudyHandler(ExternalCommander commander,
                        PresentationSurface presentation,
                        CaseContextTracker cases,
                        CriticalNoteTracker notes,
                        ImpressionSearch impressionSearch,
                        ApplicationEventPublisher publisher,
                        Clock clock) {
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.cases = Objects.requireNonNull(cases, "cases must not be null");
        this.notes = Objects.requireNonNull(notes, "notes must not be null");
        this.impressionSearch = Objects.requireNonNull(impressionSearch, "impressionSearch must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.DISCARD_STUDY);
    }

    @Override
    public void handle(ActionRequest request) {
        cases.markDiscardObserved();
        try {
            if (commander.emitKeystroke(ExternalCommand.DISCARD_STUDY)) {
                presentation.showToast("Study discarded", TOAST_MS);
                Optional<String> closed = cases.closeAfterDiscard();
                closed.ifPresent(accession -> publisher.publishEvent(new CaseTerminatedEvent(accession,
                        TerminalOutcome.CLOSED_UNSIGNED, notes.hasCriticalNoteFor(accession), clock.instant())));
                notes.reset();
                LOG.info("Study {} discarded", closed.orElse("(none)"));
            } else {
                presentation.showToast("Discard failed - try manually", TOAST_MS);
                LOG.warn("Discard command failed");
            }
        } finally {
            impressionSearch.end();
            presentation.hidePresentation();
        }
    }
}
