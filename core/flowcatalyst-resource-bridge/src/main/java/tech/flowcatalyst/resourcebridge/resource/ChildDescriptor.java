package tech.flowcatalyst.resourcebridge.resource;

/**
 * Parent-child relation edited together with the parent ("inline").
 *
 * @param resource name of the registered child resource
 * @param fkField  foreign key field on the child pointing at the parent
 */
public record ChildDescriptor(String resource, String fkField) {
}
