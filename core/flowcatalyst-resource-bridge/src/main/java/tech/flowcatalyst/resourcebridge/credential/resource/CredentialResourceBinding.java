package tech.flowcatalyst.resourcebridge.credential.resource;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.resource.ResourceBinding;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceStore;

/**
 * Registers the built-in credential resource at startup.
 */
@ApplicationScoped
public class CredentialResourceBinding implements ResourceBinding {

    @Inject
    CredentialResourceDescriptor descriptor;

    @Inject
    CredentialResourceStore store;

    @Override
    public ResourceDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public ResourceStore store() {
        return store;
    }
}
