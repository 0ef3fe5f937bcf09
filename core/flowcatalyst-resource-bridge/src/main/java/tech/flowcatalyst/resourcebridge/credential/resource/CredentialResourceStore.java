package tech.flowcatalyst.resourcebridge.credential.resource;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.credential.entity.CredentialEntity;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.panache.JpaResourceStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credential table as a resource store. Inserts and deletes are refused.
 */
@ApplicationScoped
public class CredentialResourceStore extends JpaResourceStore<CredentialEntity> {

    private static final Map<String, String> ATTRIBUTES = Map.ofEntries(
        Map.entry("token_key", "tokenKey"),
        Map.entry("secret_hash", "secretHash"),
        Map.entry("owner_principal_id", "ownerPrincipalId"),
        Map.entry("expires_at", "expiresAt"),
        Map.entry("last_used_at", "lastUsedAt"),
        Map.entry("created_at", "createdAt"),
        Map.entry("updated_at", "updatedAt")
    );

    @Inject
    CredentialResourceDescriptor descriptor;

    @Override
    protected Class<CredentialEntity> entityClass() {
        return CredentialEntity.class;
    }

    @Override
    protected ResourceDescriptor descriptor() {
        return descriptor;
    }

    @Override
    protected String attributePath(String field) {
        return ATTRIBUTES.getOrDefault(field, field);
    }

    @Override
    protected Map<String, Object> toRecord(CredentialEntity entity) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", entity.id);
        record.put("name", entity.name);
        record.put("token_key", entity.tokenKey);
        record.put("secret_hash", entity.secretHash);
        record.put("salt", entity.salt);
        record.put("owner_principal_id", entity.ownerPrincipalId);
        record.put("active", entity.active);
        record.put("expires_at", entity.expiresAt);
        record.put("last_used_at", entity.lastUsedAt);
        record.put("created_at", entity.createdAt);
        record.put("updated_at", entity.updatedAt);
        return record;
    }

    @Override
    protected CredentialEntity newEntity() {
        throw new UnsupportedOperationException("Credentials are issued through credential administration");
    }

    @Override
    protected void applyValues(CredentialEntity entity, Map<String, Object> values) {
        if (values.containsKey("name")) {
            entity.name = (String) values.get("name");
        }
        if (values.containsKey("active")) {
            entity.active = Boolean.TRUE.equals(values.get("active"));
        }
        if (values.containsKey("expires_at")) {
            entity.expiresAt = (Instant) values.get("expires_at");
        }
        entity.updatedAt = Instant.now();
    }

    @Override
    protected Object idOf(CredentialEntity entity) {
        return entity.id;
    }

    @Override
    public Object insert(Map<String, Object> values) {
        throw new UnsupportedOperationException("Credentials are issued through credential administration");
    }

    @Override
    public void delete(Object id) {
        throw new UnsupportedOperationException("Credentials are deactivated, not deleted");
    }
}
