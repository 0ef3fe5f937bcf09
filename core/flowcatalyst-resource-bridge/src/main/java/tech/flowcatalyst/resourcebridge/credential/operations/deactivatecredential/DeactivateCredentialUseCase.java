package tech.flowcatalyst.resourcebridge.credential.operations.deactivatecredential;

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
import tech.flowcatalyst.resourcebridge.credential.resource.CredentialResourceDescriptor;

/**
 * Use case for deactivating a credential.
 *
 * <p>Deactivated credentials fail verification but are kept, so their audit trail stays intact.
 */
@ApplicationScoped
public class DeactivateCredentialUseCase {

    private static final Logger LOG = Logger.getLogger(DeactivateCredentialUseCase.class);

    @Inject
    CredentialRepository repository;

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<Credential> execute(DeactivateCredentialCommand command, ExecutionContext context) {
        Credential credential = repository.findById(command.credentialId()).orElse(null);
        if (credential == null) {
            return Result.failure(UseCaseError.notFound("Credential not found"));
        }
        if (credential.active == false) {
            // Already in the requested state
            return Result.success(credential);
        }

        return unitOfWork.execute(() -> {
            credential.active = false;
            repository.update(credential);

            auditService.record(context, CredentialResourceDescriptor.NAME, credential.id, credential.toString(),
                AuditKind.CHANGE, "Deactivated credential");

            LOG.infof("Deactivated credential [%s]", credential.id);
            return Result.success(credential);
        });
    }
}
