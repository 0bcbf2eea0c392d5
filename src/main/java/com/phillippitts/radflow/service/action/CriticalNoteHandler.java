package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.service.note.CriticalNoteTracker;
import com.phillippitts.radflow.service.queue.ActionHandler;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

@Component
class CriticalNoteHandler implements ActionHandler {

    private final CriticalNoteTracker notes;
    private final CaseContextTracker cases;

    CriticalNoteHandler(CriticalNoteTracker notes, CaseContextTracker cases) {
        this.notes = Objects.requireNonNull(notes, "notes must not be null");
        this.cases = Objects.requireNonNull(cases, "cases must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.CREATE_CRITICAL_NOTE);
    }

    @Override
    public void handle(ActionRequest request) {
        String accession = request.payloadIfPresent().orElseGet(cases::currentAccession);
        notes.ensureNoteForAccession(accession);
    }
}
