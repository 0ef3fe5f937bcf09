package tech.flowcatalyst.resourcebridge.engine.operations.autocomplete;

import java.util.List;

/**
 * Autocomplete suggestions as id and display text pairs.
 */
public record Suggestions(String model, String term, int count, List<Suggestion> results) {

    public record Suggestion(Object id, String text) {}
}
