package tech.flowcatalyst.resourcebridge.resource;

/**
 * A to-many relation navigable from a record (reverse foreign keys and
 * many-to-many links).
 *
 * @param name           relation name used by callers (e.g., "articles")
 * @param targetResource name of the resource the relation yields
 */
public record RelationDescriptor(String name, String targetResource) {
}
