package com.phillippitts.radflow.service.insert;

import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MacroComposerTest {

    private TextInsertionProperties props;
    private MacroComposer composer;

    @BeforeEach
    void setUp() {
        props = new TextInsertionProperties();
        composer = new MacroComposer(props);
    }

    private static TextInsertionProperties.Macro macro(String text, List<String> required, List<String> exclude) {
        TextInsertionProperties.Macro m = new TextInsertionProperties.Macro();
        m.setName(text);
        m.setText(text);
        m.getCriteria().setRequired(required);
        m.getCriteria().setExclude(exclude);
        return m;
    }

    @Test
    void joinsEveryMatchingMacroInOrder() {
        // Arrange
        props.setMacros(List.of(
                macro("Head macro.", List.of("HEAD"), List.of()),
                macro("Chest macro.", List.of("CHEST"), List.of()),
                macro("CT macro.", List.of("CT"), List.of("ANGIO"))));

        // Act / Assert
        assertThat(composer.compose("ct head wo")).contains("Head macro.\nCT macro.");
    }

    @Test
    void skipsDisabledAndEmptyMacros() {
        // Arrange
        TextInsertionProperties.Macro disabled = macro("Disabled.", List.of(), List.of());
        disabled.setEnabled(false);
        props.setMacros(List.of(disabled, macro(" ", List.of(), List.of())));

        // Act / Assert
        assertThat(composer.compose("CT HEAD")).isEmpty();
    }

    @Test
    void nothingWithoutDescriptionOrWhenDisabled() {
        // Arrange
        props.setMacros(List.of(macro("Any.", List.of(), List.of())));

        // Act / Assert
        assertThat(composer.compose(" ")).isEmpty();
        props.setMacrosEnabled(false);
        assertThat(composer.compose("CT HEAD")).isEmpty();
    }

    @Test
    void excludedTermBlocksMacro() {
        // Arrange
        props.setMacros(List.of(macro("CT macro.", List.of("CT"), List.of("ANGIO"))));

        // Act / Assert
        assertThat(composer.compose("CT ANGIO HEAD")).isEmpty();
    }
}
