package com.phillippitts.radflow.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Configuration for text pasted into the report: macros inserted automatically when a
 * matching study opens, and pick lists the user picks from on demand.
 */
@ConfigurationProperties(prefix = "insert")
@Validated
public class TextInsertionProperties {

    private boolean macrosEnabled = true;

    /** Prefix inserted macros with blank lines so they sit below the dictation cursor. */
    private boolean macroBlankLines = true;

    private boolean pickListsEnabled = true;

    private List<Macro> macros = new ArrayList<>();
    private List<PickList> pickLists = new ArrayList<>();

    public boolean isMacrosEnabled() {
        return macrosEnabled;
    }

    public void setMacrosEnabled(boolean macrosEnabled) {
        this.macrosEnabled = macrosEnabled;
    }

    public boolean isMacroBlankLines() {
        return macroBlankLines;
    }

    public void setMacroBlankLines(boolean macroBlankLines) {
        this.macroBlankLines = macroBlankLines;
    }

    public boolean isPickListsEnabled() {
        return pickListsEnabled;
    }

    public void setPickListsEnabled(boolean pickListsEnabled) {
        this.pickListsEnabled = pickListsEnabled;
    }

    public List<Macro> getMacros() {
        return macros;
    }

    public void setMacros(List<Macro> macros) {
        this.macros = macros;
    }

    public List<PickList> getPickLists() {
        return pickLists;
    }

    public void setPickLists(List<PickList> pickLists) {
        this.pickLists = pickLists;
    }

    public Optional<PickList> findPickList(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return pickLists.stream()
                .filter(p -> name.equalsIgnoreCase(p.getName()))
                .findFirst();
    }

    /**
     * Study description filter. All {@code required} terms must appear, at least one
     * {@code anyOf} term must appear when that list is non-empty, and no {@code exclude} term may appear.
     * Matching is case-insensitive substring matching.
     */
    public static class StudyCriteria {
        private List<String> required = new ArrayList<>();
        private List<String> anyOf = new ArrayList<>();
        private List<String> exclude = new ArrayList<>();

        public List<String> getRequired() {
            return required;
        }

        public void setRequired(List<String> required) {
            this.required = required;
        }

        public List<String> getAnyOf() {
            return anyOf;
        }

        public void setAnyOf(List<String> anyOf) {
            this.anyOf = anyOf;
        }

        public List<String> getExclude() {
            return exclude;
        }

        public void setExclude(List<String> exclude) {
            this.exclude = exclude;
        }

        public boolean matches(String description) {
            String d = description == null ? "" : description.toUpperCase(Locale.ROOT);
            for (String term : required) {
                if (!d.contains(term.toUpperCase(Locale.ROOT))) {
                    return false;
                }
            }
            if (!anyOf.isEmpty() && anyOf.stream().noneMatch(t -> d.contains(t.toUpperCase(Locale.ROOT)))) {
                return false;
            }
            return exclude.stream().noneMatch(t -> d.contains(t.toUpperCase(Locale.ROOT)));
        }
    }

    /**
     * Text inserted once per case when the study description matches.
     */
    public static class Macro {
        private String name;
        private boolean enabled = true;
        private StudyCriteria criteria = new StudyCriteria();
        private String text = "";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public StudyCriteria getCriteria() {
            return criteria;
        }

        public void setCriteria(StudyCriteria criteria) {
            this.criteria = criteria;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }
    }

    /**
     * A named list of snippets. An item either carries its own text or references another
     * list whose items are inserted together.
     */
    public static class PickList {
        private String name;
        private boolean enabled = true;
        private StudyCriteria criteria = new StudyCriteria();
        private List<Item> items = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public StudyCriteria getCriteria() {
            return criteria;
        }

        public void setCriteria(StudyCriteria criteria) {
            this.criteria = criteria;
        }

        public List<Item> getItems() {
            return items;
        }

        public void setItems(List<Item> items) {
            this.items = items;
        }
    }

    /**
     * One pick-list entry.
     */
    public static class Item {
        private String label;
        private String text;
        /** Name of another pick list to insert instead of {@code text}. */
        private String reference;

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getReference() {
            return reference;
        }

        public void setReference(String reference) {
            this.reference = reference;
        }

        public boolean isReference() {
            return reference != null && !reference.isBlank();
        }
    }
}
