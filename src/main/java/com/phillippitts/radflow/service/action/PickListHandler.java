package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import com.phillippitts.radflow.config.properties.TextInsertionProperties.Item;
import com.phillippitts.radflow.config.properties.TextInsertionProperties.PickList;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.exception.InvalidReferenceException;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.insert.ClipboardPasteService;
import com.phillippitts.radflow.service.insert.PickListSelection;
import com.phillippitts.radflow.service.queue.ActionHandler;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shows the pick lists that apply to the open study and inserts the item the user picks.
 *
 * <p>An item that references another list inserts that list's items. A reference to a
 * missing or disabled list aborts with a blocking notice and leaves the clipboard untouched.
 */
@Component
class PickListHandler implements ActionHandler {

    private static final Logger LOG = LogManager.getLogger(PickListHandler.class);
    static final int TOAST_MS = 2000;
    static final String NOTICE_TITLE = "Pick List";
    static final String INVALID_REFERENCE_NOTICE = "The referenced list is not available (deleted or disabled).";

    private final TextInsertionProperties props;
    private final ClipboardPasteService pasteService;
    private final PresentationSurface presentation;
    private final CaseContextTracker cases;

    PickListHandler(TextInsertionProperties props,
                    ClipboardPasteService pasteService,
                    PresentationSurface presentation,
                    CaseContextTracker cases) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.pasteService = Objects.requireNonNull(pasteService, "pasteService must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.cases = Objects.requireNonNull(cases, "cases must not be null");
    }

    @Override
    public Set<ActionKind> kinds() {
        return EnumSet.of(ActionKind.SHOW_PICK_LISTS, ActionKind.INSERT_PICK_LIST_TEXT);
    }

    @Override
    public void handle(ActionRequest request) {
        if (request.kind() == ActionKind.SHOW_PICK_LISTS) {
            showPickLists();
        } else {
            insert(PickListSelection.parse(request.payload()));
        }
    }

    private void showPickLists() {
        if (!props.isPickListsEnabled()) {
            presentation.showToast("Pick lists are disabled", TOAST_MS);
            return;
        }
        if (props.getPickLists().isEmpty()) {
            presentation.showToast("No pick lists configured", TOAST_MS);
            return;
        }
        String description = cases.current().description();
        List<PickList> matching = props.getPickLists().stream()
                .filter(PickList::isEnabled)
                .filter(p -> p.getCriteria() == null || p.getCriteria().matches(description))
                .toList();
        if (matching.isEmpty()) {
            presentation.showToast("No pick lists match this study", TOAST_MS);
            return;
        }
        presentation.showPickLists(matching);
    }

    private void insert(PickListSelection selection) {
        String text;
        try {
            text = resolve(selection);
        } catch (InvalidReferenceException e) {
            LOG.warn("Pick list reference '{}' unavailable", e.getReference());
            presentation.showBlockingNotice(NOTICE_TITLE, INVALID_REFERENCE_NOTICE);
            return;
        }
        pasteService.paste(text, selection.listName());
    }

    /**
     * @throws IllegalArgumentException  if the selection does not name an existing item
     * @throws InvalidReferenceException if the item references a missing or disabled list
     */
    String resolve(PickListSelection selection) {
        PickList list = props.findPickList(selection.listName())
                .orElseThrow(() -> new IllegalArgumentException("Unknown pick list: " + selection.listName()));
        if (selection.itemIndex() >= list.getItems().size()) {
            throw new IllegalArgumentException("Pick list " + list.getName() + " has no item " + selection.itemIndex());
        }
        Item item = list.getItems().get(selection.itemIndex());
        if (!item.isReference()) {
            return item.getText() == null ? "" : item.getText();
        }
        PickList target = props.findPickList(item.getReference())
                .filter(PickList::isEnabled)
                .orElseThrow(() -> new InvalidReferenceException(item.getReference(),
                        "Referenced pick list is missing or disabled: " + item.getReference()));
        return target.getItems().stream()
                .filter(i -> !i.isReference())
                .map(Item::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));
    }
}
