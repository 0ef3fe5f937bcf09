package tech.flowcatalyst.resourcebridge.resource;

/**
 * A descriptor paired with its store. CDI beans of this type are registered
 * at startup by {@link ResourceRegistrar}.
 */
public interface ResourceBinding {

    ResourceDescriptor descriptor();

    ResourceStore store();
}
