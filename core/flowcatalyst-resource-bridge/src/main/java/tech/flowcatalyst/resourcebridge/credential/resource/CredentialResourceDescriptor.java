package tech.flowcatalyst.resourcebridge.credential.resource;

import jakarta.enterprise.context.ApplicationScoped;
import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;
import tech.flowcatalyst.resourcebridge.authorization.Principal;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldType;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exposes credentials themselves as a resource.
 *
 * <p>Credentials can be viewed and changed (renamed, deactivated, re-dated)
 * but never added or deleted this way: issuing needs the one-time plaintext
 * token, and credentials are retired rather than destroyed. The key, hash and
 * salt are never serialized.
 */
@ApplicationScoped
public class CredentialResourceDescriptor implements ResourceDescriptor {

    public static final String NAME = "credential";

    private static final List<FieldDescriptor> FIELDS = List.of(
        FieldDescriptor.builder("id", FieldType.STRING).primaryKey().verboseName("ID").build(),
        FieldDescriptor.builder("name", FieldType.STRING).maxLength(200)
            .helpText("A descriptive name for this credential").build(),
        FieldDescriptor.builder("token_key", FieldType.STRING).readOnly().build(),
        FieldDescriptor.builder("secret_hash", FieldType.STRING).readOnly().build(),
        FieldDescriptor.builder("salt", FieldType.STRING).readOnly().build(),
        FieldDescriptor.builder("owner_principal_id", FieldType.STRING).optional().readOnly()
            .helpText("Principal that actions taken with this credential are attributed to").build(),
        FieldDescriptor.builder("active", FieldType.BOOLEAN).defaultValue(Boolean.TRUE).build(),
        FieldDescriptor.builder("expires_at", FieldType.DATETIME).optional()
            .helpText("Leave empty for a credential that never expires").build(),
        FieldDescriptor.builder("last_used_at", FieldType.DATETIME).optional().readOnly().build(),
        FieldDescriptor.builder("created_at", FieldType.DATETIME).optional().readOnly().build(),
        FieldDescriptor.builder("updated_at", FieldType.DATETIME).optional().readOnly().build()
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<FieldDescriptor> fields() {
        return FIELDS;
    }

    @Override
    public String appLabel() {
        return "resourcebridge";
    }

    @Override
    public List<String> searchableFields() {
        return List.of("name");
    }

    @Override
    public List<String> defaultOrdering() {
        return List.of("-created_at");
    }

    @Override
    public List<String> listDisplay() {
        return List.of("name", "active", "expires_at", "last_used_at");
    }

    @Override
    public List<String> listFilter() {
        return List.of("active");
    }

    @Override
    public Set<String> readonlyFields() {
        return Set.of("owner_principal_id", "last_used_at", "created_at", "updated_at");
    }

    @Override
    public Set<String> excludedFields() {
        return Set.of("token_key", "secret_hash", "salt");
    }

    @Override
    public String displayText(Map<String, Object> record) {
        return String.valueOf(record.get("name"));
    }

    @Override
    public boolean hasPermission(Principal principal, PermissionAction action) {
        if (action == PermissionAction.ADD || action == PermissionAction.DELETE) {
            return false;
        }
        return principal.hasPermission(NAME, action);
    }
}
