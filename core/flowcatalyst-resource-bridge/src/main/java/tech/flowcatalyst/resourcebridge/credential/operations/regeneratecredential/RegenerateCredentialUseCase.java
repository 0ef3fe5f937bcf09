package tech.flowcatalyst.resourcebridge.credential.operations.regeneratecredential;

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
import tech.flowcatalyst.resourcebridge.credential.operations.createcredential.CredentialIssued;
import tech.flowcatalyst.resourcebridge.credential.resource.CredentialResourceDescriptor;

/**
 * Use case for regenerating a credential's secret.
 *
 * <p>The token key is kept; salt, hash and secret are replaced, so the old
 * token stops verifying as soon as the transaction commits.
 */
@ApplicationScoped
public class RegenerateCredentialUseCase {

    private static final Logger LOG = Logger.getLogger(RegenerateCredentialUseCase.class);

    @Inject
    CredentialRepository repository;

    @Inject
    CredentialService credentialService;

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<CredentialIssued> execute(RegenerateCredentialCommand command, ExecutionContext context) {
        Credential credential = repository.findById(command.credentialId()).orElse(null);
        if (credential == null) {
            return Result.failure(UseCaseError.notFound("Credential not found"));
        }

        return unitOfWork.execute(() -> {
            String token = credentialService.assignSecret(credential);
            repository.update(credential);

            auditService.record(context, CredentialResourceDescriptor.NAME, credential.id, credential.toString(),
                AuditKind.CHANGE, "Credential secret regenerated");

            LOG.infof("Regenerated secret of credential [%s]", credential.id);

            return Result.success(CredentialIssued.builder()
                .credential(credential)
                .plaintextToken(token)
                .build());
        });
    }
}
