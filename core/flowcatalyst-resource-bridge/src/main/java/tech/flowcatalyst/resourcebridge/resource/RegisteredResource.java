package tech.flowcatalyst.resourcebridge.resource;

/**
 * Registry entry for one resource.
 */
public record RegisteredResource(ResourceDescriptor descriptor, ResourceStore store) {

    public String name() {
        return descriptor.name();
    }
}
