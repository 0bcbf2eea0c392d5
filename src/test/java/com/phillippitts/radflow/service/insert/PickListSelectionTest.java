package com.phillippitts.radflow.service.insert;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PickListSelectionTest {

    @Test
    void parsesListNameAndIndex() {
        // Act
        PickListSelection selection = PickListSelection.parse("Lung #2#3");

        // Assert
        assertThat(selection.listName()).isEqualTo("Lung #2");
        assertThat(selection.itemIndex()).isEqualTo(3);
        assertThat(selection.encode()).isEqualTo("Lung #2#3");
    }

    @Test
    void rejectsMalformedPayloads() {
        assertThatThrownBy(() -> PickListSelection.parse(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PickListSelection.parse("Lung")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PickListSelection.parse("#1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PickListSelection.parse("Lung#")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PickListSelection.parse("Lung#x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a number");
        assertThatThrownBy(() -> PickListSelection.parse("Lung#-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(">= 0");
    }
}
