package com.phillippitts.radflow.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * A request to run one action on the action worker. Immutable; created at enqueue time
 * and consumed once.
 *
 * @param kind    what to do
 * @param source  who asked (hotkey, device button name, API, internal); drives source-specific policy
 * @param payload optional action argument (macro text, pick-list selection, accession); may be null
 */
public record ActionRequest(ActionKind kind, String source, String payload) {

    public ActionRequest {
        Objects.requireNonNull(kind, "kind must not be null");
        source = (source == null || source.isBlank()) ? ActionSources.INTERNAL : source;
    }

    public static ActionRequest of(ActionKind kind, String source) {
        return new ActionRequest(kind, source, null);
    }

    public Optional<String> payloadIfPresent() {
        return Optional.ofNullable(payload).filter(p -> !p.isEmpty());
    }

    public boolean isFrom(String candidate) {
        return source.equals(candidate);
    }
}
