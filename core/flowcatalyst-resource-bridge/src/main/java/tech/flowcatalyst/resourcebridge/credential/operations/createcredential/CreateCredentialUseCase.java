package tech.flowcatalyst.resourcebridge.credential.operations.createcredential;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditService;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.UnitOfWork;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.credential.Credential;
import tech.flowcatalyst.resourcebridge.credential.CredentialRepository;
import tech.flowcatalyst.resourcebridge.credential.CredentialService;
import tech.flowcatalyst.resourcebridge.credential.resource.CredentialResourceDescriptor;
import tech.flowcatalyst.resourcebridge.shared.EntityType;
import tech.flowcatalyst.resourcebridge.shared.TsidGenerator;

import java.time.Instant;
import java.util.HashSet;
import java.util.Map;

/**
 * Use case for issuing a new credential.
 *
 * <p>The credential and its audit entry are committed together. The plaintext
 * token is returned in {@link CredentialIssued} and never stored.
 */
@ApplicationScoped
public class CreateCredentialUseCase {

    private static final Logger LOG = Logger.getLogger(CreateCredentialUseCase.class);

    static final int MAX_NAME_LENGTH = 200;

    @Inject
    CredentialRepository repository;

    @Inject
    CredentialService credentialService;

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<CredentialIssued> execute(CreateCredentialCommand command, ExecutionContext context) {
        if (command.name() == null || command.name().isBlank()) {
            return Result.failure(UseCaseError.validation("Credential name is required"));
        }
        if (command.name().length() > MAX_NAME_LENGTH) {
            return Result.failure(UseCaseError.validation(
                "Credential name must be at most " + MAX_NAME_LENGTH + " characters",
                Map.of("field", "name")
            ));
        }

        Instant now = Instant.now();
        if (!command.neverExpires() && command.expiresAt() != null && !command.expiresAt().isAfter(now)) {
            return Result.failure(UseCaseError.validation(
                "Expiry must be in the future",
                Map.of("field", "expires_at")
            ));
        }

        return unitOfWork.execute(() -> {
            Credential credential = new Credential();
            credential.id = TsidGenerator.generate(EntityType.CREDENTIAL);
            credential.name = command.name();
            credential.ownerPrincipalId = command.ownerPrincipalId();
            credential.active = true;
            credential.expiresAt = resolveExpiry(command, now);
            credential.permissions = command.permissions() != null ? new HashSet<>(command.permissions()) : new HashSet<>();
            credential.groupNames = command.groupNames() != null ? new HashSet<>(command.groupNames()) : new HashSet<>();
            credential.createdAt = now;

            String token = credentialService.assignSecret(credential);
            repository.persist(credential);

            auditService.record(context, CredentialResourceDescriptor.NAME, credential.id, credential.toString(),
                AuditKind.ADDITION, "Credential issued");

            LOG.infof("Issued credential [%s] '%s' (expires %s)", credential.id, credential.name,
                credential.expiresAt != null ? credential.expiresAt : "never");

            return Result.success(CredentialIssued.builder()
                .credential(credential)
                .plaintextToken(token)
                .build());
        });
    }

    private Instant resolveExpiry(CreateCredentialCommand command, Instant now) {
        if (command.neverExpires()) {
            return null;
        }
        if (command.expiresAt() != null) {
            return command.expiresAt();
        }
        return credentialService.defaultExpiry(now);
    }
}
