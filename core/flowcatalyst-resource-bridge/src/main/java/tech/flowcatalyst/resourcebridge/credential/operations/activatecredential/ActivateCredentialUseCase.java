package tech.flowcatalyst.resourcebridge.credential.operations.activatecredential;

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
 * Use case for activating a credential.
 *
 * <p>An expired credential stays unusable after activation until its expiry is changed.
 */
@ApplicationScoped
public class ActivateCredentialUseCase {

    private static final Logger LOG = Logger.getLogger(ActivateCredentialUseCase.class);

    @Inject
    CredentialRepository repository;

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<Credential> execute(ActivateCredentialCommand command, ExecutionContext context) {
        Credential credential = repository.findById(command.credentialId()).orElse(null);
        if (credential == null) {
            return Result.failure(UseCaseError.notFound("Credential not found"));
        }
        if (credential.active == true) {
            // Already in the requested state
            return Result.success(credential);
        }

        return unitOfWork.execute(() -> {
            credential.active = true;
            repository.update(credential);

            auditService.record(context, CredentialResourceDescriptor.NAME, credential.id, credential.toString(),
                AuditKind.CHANGE, "Activated credential");

            LOG.infof("Activated credential [%s]", credential.id);
            return Result.success(credential);
        });
    }
}
