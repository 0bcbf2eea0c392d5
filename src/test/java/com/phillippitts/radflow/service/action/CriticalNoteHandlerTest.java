package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.service.note.CriticalNoteTracker;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CriticalNoteHandlerTest {

    private CriticalNoteTracker notes;
    private CaseContextTracker cases;
    private CriticalNoteHandler handler;

    @BeforeEach
    void setUp() {
        notes = mock(CriticalNoteTracker.class);
        cases = new CaseContextTracker();
        handler = new CriticalNoteHandler(notes, cases);
        cases.observe("ACC1");
    }

    @Test
    void usesAccessionFromPayload() {
        // Act
        handler.handle(new ActionRequest(ActionKind.CREATE_CRITICAL_NOTE, ActionSources.INTERNAL, "ACC0"));

        // Assert
        verify(notes).ensureNoteForAccession("ACC0");
    }

    @Test
    void fallsBackToLiveCase() {
        // Act
        handler.handle(ActionRequest.of(ActionKind.CREATE_CRITICAL_NOTE, ActionSources.HOTKEY));

        // Assert
        verify(notes).ensureNoteForAccession("ACC1");
    }
}
