package tech.flowcatalyst.resourcebridge.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;

import java.time.Instant;

/**
 * Writes audit entries for record mutations.
 *
 * <p>Must be called inside the unit of work of the mutation it documents.
 * Entries are skipped entirely when the execution has no audit principal.
 */
@ApplicationScoped
public class AuditService {

    private static final Logger LOG = Logger.getLogger(AuditService.class);

    @Inject
    AuditLogRepository repository;

    @Inject
    ResourceBridgeConfig config;

    /**
     * Append an entry.
     *
     * @return true if written, false if skipped for lack of a principal
     */
    public boolean record(
            ExecutionContext context,
            String resource,
            Object objectId,
            String objectRepr,
            AuditKind kind,
            String changeMessage
    ) {
        String principalId = context.auditPrincipalId();
        if (principalId == null) {
            LOG.debugf("No audit principal, skipping %s entry for %s [%s]", kind, resource, objectId);
            return false;
        }

        AuditLog log = new AuditLog();
        log.resource = resource;
        log.objectId = String.valueOf(objectId);
        log.objectRepr = truncate(objectRepr, config.engine().auditReprMaxLength());
        log.kind = kind;
        log.changeMessage = changeMessage != null ? changeMessage : "";
        log.principalId = principalId;
        log.performedAt = Instant.now();

        repository.persist(log);
        return true;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
