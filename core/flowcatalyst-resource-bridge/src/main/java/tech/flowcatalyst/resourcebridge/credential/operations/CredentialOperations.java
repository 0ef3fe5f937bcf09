package tech.flowcatalyst.resourcebridge.credential.operations;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.OffsetPage;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.credential.Credential;
import tech.flowcatalyst.resourcebridge.credential.CredentialRepository;
import tech.flowcatalyst.resourcebridge.credential.operations.activatecredential.ActivateCredentialCommand;
import tech.flowcatalyst.resourcebridge.credential.operations.activatecredential.ActivateCredentialUseCase;
import tech.flowcatalyst.resourcebridge.credential.operations.createcredential.CreateCredentialCommand;
import tech.flowcatalyst.resourcebridge.credential.operations.createcredential.CreateCredentialUseCase;
import tech.flowcatalyst.resourcebridge.credential.operations.createcredential.CredentialIssued;
import tech.flowcatalyst.resourcebridge.credential.operations.deactivatecredential.DeactivateCredentialCommand;
import tech.flowcatalyst.resourcebridge.credential.operations.deactivatecredential.DeactivateCredentialUseCase;
import tech.flowcatalyst.resourcebridge.credential.operations.regeneratecredential.RegenerateCredentialCommand;
import tech.flowcatalyst.resourcebridge.credential.operations.regeneratecredential.RegenerateCredentialUseCase;

import java.util.Optional;

/**
 * Facade for credential administration.
 * Mutations require an ExecutionContext; queries don't.
 */
@ApplicationScoped
public class CredentialOperations {

    @Inject
    CreateCredentialUseCase createUseCase;

    @Inject
    RegenerateCredentialUseCase regenerateUseCase;

    @Inject
    DeactivateCredentialUseCase deactivateUseCase;

    @Inject
    ActivateCredentialUseCase activateUseCase;

    @Inject
    CredentialRepository repository;

    // ==================== MUTATIONS (require ExecutionContext) ====================

    /**
     * Issue a credential. The plaintext token is only in the returned value.
     */
    public Result<CredentialIssued> create(CreateCredentialCommand command, ExecutionContext context) {
        return createUseCase.execute(command, context);
    }

    /**
     * Replace a credential's secret. The old token stops working.
     */
    public Result<CredentialIssued> regenerate(RegenerateCredentialCommand command, ExecutionContext context) {
        return regenerateUseCase.execute(command, context);
    }

    public Result<Credential> deactivate(DeactivateCredentialCommand command, ExecutionContext context) {
        return deactivateUseCase.execute(command, context);
    }

    public Result<Credential> activate(ActivateCredentialCommand command, ExecutionContext context) {
        return activateUseCase.execute(command, context);
    }

    // ==================== QUERIES ====================

    public Optional<Credential> findById(String id) {
        return repository.findById(id);
    }

    /**
     * Credentials, newest first.
     */
    public OffsetPage<Credential> list(int offset, int limit) {
        return repository.findPage(offset, limit);
    }
}
