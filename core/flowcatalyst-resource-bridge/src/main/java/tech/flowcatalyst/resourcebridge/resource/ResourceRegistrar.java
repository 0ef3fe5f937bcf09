package tech.flowcatalyst.resourcebridge.resource;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Registers every {@link ResourceBinding} bean when the application starts.
 */
@ApplicationScoped
public class ResourceRegistrar {

    private static final Logger LOG = Logger.getLogger(ResourceRegistrar.class);

    @Inject
    ResourceRegistry registry;

    @Inject
    Instance<ResourceBinding> bindings;

    void onStart(@Observes StartupEvent event) {
        LOG.info("Registering bridge resources...");

        int registered = 0;
        for (ResourceBinding binding : bindings) {
            if (registry.register(binding)) {
                registered++;
            }
        }

        LOG.infof("Resource registration complete. %d registered, %d total", registered, registry.size());
    }
}
