package tech.flowcatalyst.resourcebridge.engine.operations.autocomplete;

/**
 * @param term  search term, or null to list the first records
 * @param limit maximum suggestions, or null for the configured default
 */
public record AutocompleteCommand(String term, Integer limit) {}
