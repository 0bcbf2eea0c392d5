package com.phillippitts.radflow.service.action;

import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import com.phillippitts.radflow.config.properties.TextInsertionProperties.Item;
import com.phillippitts.radflow.config.properties.TextInsertionProperties.PickList;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.exception.InvalidReferenceException;
import com.phillippitts.radflow.service.insert.ClipboardPasteService;
import com.phillippitts.radflow.service.insert.PickListSelection;
import com.phillippitts.radflow.service.study.CaseContextTracker;
import com.phillippitts.radflow.testutil.FakeClipboard;
import com.phillippitts.radflow.testutil.MutableClock;
import com.phillippitts.radflow.testutil.RecordingCommander;
import com.phillippitts.radflow.testutil.RecordingPresentationSurface;
import com.phillippitts.radflow.util.Pause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PickListHandlerTest {

    private TextInsertionProperties props;
    private FakeClipboard clipboard;
    private RecordingPresentationSurface presentation;
    private CaseContextTracker cases;
    private PickListHandler handler;

    @BeforeEach
    void setUp() {
        props = new TextInsertionProperties();
        clipboard = new FakeClipboard();
        presentation = new RecordingPresentationSurface();
        cases = new CaseContextTracker();
        ClipboardPasteService paste = new ClipboardPasteService(clipboard, new RecordingCommander(), presentation,
                Pause.NONE, new MutableClock());
        handler = new PickListHandler(props, paste, presentation, cases);
    }

    private static Item item(String text) {
        Item item = new Item();
        item.setLabel(text);
        item.setText(text);
        return item;
    }

    private static Item reference(String listName) {
        Item item = new Item();
        item.setLabel("-> " + listName);
        item.setReference(listName);
        return item;
    }

    private PickList list(String name, Item... items) {
        PickList list = new PickList();
        list.setName(name);
        list.setItems(new ArrayList<>(List.of(items)));
        props.getPickLists().add(list);
        return list;
    }

    private void insert(String payload) {
        handler.handle(new ActionRequest(ActionKind.INSERT_PICK_LIST_TEXT, ActionSources.API, payload));
    }

    @Test
    void showReportsNoListsConfigured() {
        // Act
        handler.handle(ActionRequest.of(ActionKind.SHOW_PICK_LISTS, ActionSources.HOTKEY));

        // Assert
        assertThat(presentation.lastToast()).isEqualTo("No pick lists configured");
        assertThat(presentation.pickListsShown()).isEmpty();
    }

    @Test
    void showReportsDisabledFeature() {
        // Arrange
        props.setPickListsEnabled(false);
        list("Chest", item("Clear lungs."));

        // Act
        handler.handle(ActionRequest.of(ActionKind.SHOW_PICK_LISTS, ActionSources.HOTKEY));

        // Assert
        assertThat(presentation.lastToast()).isEqualTo("Pick lists are disabled");
    }

    @Test
    void showFiltersByStudyDescription() {
        // Arrange
        cases.observe("ACC1");
        cases.updateDescription("CT HEAD WO CONTRAST");
        PickList head = list("Head", item("No hemorrhage."));
        head.getCriteria().setRequired(List.of("head"));
        PickList chest = list("Chest", item("Clear lungs."));
        chest.getCriteria().setRequired(List.of("chest"));
        PickList disabled = list("Old", item("Unused."));
        disabled.setEnabled(false);

        // Act
        handler.handle(ActionRequest.of(ActionKind.SHOW_PICK_LISTS, ActionSources.HOTKEY));

        // Assert
        assertThat(presentation.pickListsShown()).extracting(PickList::getName).containsExactly("Head");
    }

    @Test
    void showReportsNoMatch() {
        // Arrange
        cases.observe("ACC1");
        cases.updateDescription("MR KNEE");
        list("Chest", item("Clear lungs.")).getCriteria().setRequired(List.of("chest"));

        // Act
        handler.handle(ActionRequest.of(ActionKind.SHOW_PICK_LISTS, ActionSources.HOTKEY));

        // Assert
        assertThat(presentation.lastToast()).isEqualTo("No pick lists match this study");
    }

    @Test
    void insertsPlainItem() {
        // Arrange
        list("Chest", item("Clear lungs."), item("Small effusion."));

        // Act
        insert("Chest#1");

        // Assert
        assertThat(clipboard.writes()).containsExactly("Small effusion.");
        assertThat(presentation.lastToast()).isEqualTo("Inserted Chest");
    }

    @Test
    void referenceInsertsTargetListItems() {
        // Arrange
        list("Normal", item("Line one."), reference("Chest"), item("Line two."));
        list("Chest", reference("Normal"));

        // Act
        String text = handler.resolve(new PickListSelection("Chest", 0));

        // Assert
        assertThat(text).isEqualTo("Line one.\nLine two.");
    }

    @Test
    void disabledReferenceShowsNoticeAndLeavesClipboard() {
        // Arrange
        list("Normal", item("Line one.")).setEnabled(false);
        list("Chest", reference("Normal"));

        // Act
        insert("Chest#0");

        // Assert
        assertThat(presentation.notices())
                .containsExactly(PickListHandler.NOTICE_TITLE + ": " + PickListHandler.INVALID_REFERENCE_NOTICE);
        assertThat(clipboard.writes()).isEmpty();
    }

    @Test
    void missingReferenceIsInvalid() {
        // Arrange
        list("Chest", reference("Deleted"));

        // Act / Assert
        assertThatThrownBy(() -> handler.resolve(new PickListSelection("Chest", 0)))
                .isInstanceOf(InvalidReferenceException.class);
    }

    @Test
    void unknownListOrItemIsRejected() {
        // Arrange
        list("Chest", item("Clear lungs."));

        // Act / Assert
        assertThatThrownBy(() -> insert("Spine#0")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown pick list");
        assertThatThrownBy(() -> insert("Chest#3")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no item 3");
    }
}
