package com.phillippitts.radflow.service.insert;

import com.phillippitts.radflow.config.properties.TextInsertionProperties;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selects the macros whose criteria match a study description and joins their text.
 */
@Component
public class MacroComposer {

    private final TextInsertionProperties props;

    public MacroComposer(TextInsertionProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * @return combined text of all enabled matching macros, empty if macros are off or none match
     */
    public Optional<String> compose(String description) {
        if (!props.isMacrosEnabled() || description == null || description.isBlank()) {
            return Optional.empty();
        }
        String text = props.getMacros().stream()
                .filter(TextInsertionProperties.Macro::isEnabled)
                .filter(m -> m.getText() != null && !m.getText().isBlank())
                .filter(m -> m.getCriteria() == null || m.getCriteria().matches(description))
                .map(TextInsertionProperties.Macro::getText)
                .collect(Collectors.joining("\n"));
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
