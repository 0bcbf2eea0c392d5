package com.phillippitts.radflow.service.insert;

import java.util.Objects;

/**
 * A chosen pick-list item, carried as an action payload in the form {@code list#index}.
 */
public record PickListSelection(String listName, int itemIndex) {

    public PickListSelection {
        Objects.requireNonNull(listName, "listName must not be null");
        if (listName.isBlank()) {
            throw new IllegalArgumentException("listName must not be blank");
        }
        if (itemIndex < 0) {
            throw new IllegalArgumentException("itemIndex must be >= 0");
        }
    }

    /**
     * @throws IllegalArgumentException if the payload is not {@code name#index}
     */
    public static PickListSelection parse(String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Pick list selection is missing");
        }
        int hash = payload.lastIndexOf('#');
        if (hash <= 0 || hash == payload.length() - 1) {
            throw new IllegalArgumentException("Pick list selection must look like 'list#index': " + payload);
        }
        try {
            return new PickListSelection(payload.substring(0, hash), Integer.parseInt(payload.substring(hash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Pick list item index is not a number: " + payload, e);
        }
    }

    public String encode() {
        return listName + "#" + itemIndex;
    }
}
