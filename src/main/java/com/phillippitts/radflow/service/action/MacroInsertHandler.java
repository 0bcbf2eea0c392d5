package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.service.insert.ClipboardPasteService;
import com.phillippitts.radflow.service.queue.ActionHandler;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

@Component
class MacroInsertHandler implements ActionHandler {

    static final int BLANK_LINES = 10;

    private final ClipboardPasteService pasteService;
    private final TextInsertionProperties props;

    MacroInsertHandler(ClipboardPasteService pasteService, TextInsertionProperties props) {
        this.pasteService = Objects.requireNonNull(pasteService, "pasteService must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.INSERT_MACROS);
    }

    @Override
    public void handle(ActionRequest request) {
        request.payloadIfPresent().ifPresent(text -> {
            String body = props.isMacroBlankLines() ? " \n".repeat(BLANK_LINES) + text : text;
            pasteService.paste(body, "macros");
        });
    }
}
