package tech.flowcatalyst.resourcebridge.resource;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of resources exposed through commands.
 *
 * <p>Registration is insert-if-absent: the first binding for a name wins and
 * re-registering an existing name is a no-op. Entries are never replaced or
 * removed, so readers need no further coordination.
 */
@ApplicationScoped
public class ResourceRegistry {

    private static final Logger LOG = Logger.getLogger(ResourceRegistry.class);

    private final Map<String, RegisteredResource> resources = new ConcurrentHashMap<>();

    /**
     * Register a resource.
     *
     * @return true if registered, false if the name was already taken
     */
    public boolean register(ResourceDescriptor descriptor, ResourceStore store) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(store, "store must not be null");

        String name = descriptor.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name cannot be null or blank");
        }
        if (name.contains(" ")) {
            throw new IllegalArgumentException("Resource name cannot contain spaces: " + name);
        }

        RegisteredResource existing = resources.putIfAbsent(name, new RegisteredResource(descriptor, store));
        if (existing != null) {
            LOG.debugf("Resource already registered, skipping: %s", name);
            return false;
        }
        LOG.infof("Registered resource [%s] with %d fields", name, descriptor.fields().size());
        return true;
    }

    public boolean register(ResourceBinding binding) {
        return register(binding.descriptor(), binding.store());
    }

    public Optional<RegisteredResource> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(resources.get(name));
    }

    public boolean isRegistered(String name) {
        return name != null && resources.containsKey(name);
    }

    /**
     * All registered resources, ordered by name.
     */
    public List<RegisteredResource> all() {
        List<RegisteredResource> sorted = new ArrayList<>(resources.values());
        sorted.sort(Comparator.comparing(RegisteredResource::name));
        return sorted;
    }

    public int size() {
        return resources.size();
    }
}
