package tech.flowcatalyst.resourcebridge.credential.operations;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditService;
import tech.flowcatalyst.resourcebridge.authorization.Permission;
import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.credential.Credential;
import tech.flowcatalyst.resourcebridge.credential.CredentialRepository;
import tech.flowcatalyst.resourcebridge.credential.CredentialService;
import tech.flowcatalyst.resourcebridge.credential.operations.createcredential.CreateCredentialCommand;
import tech.flowcatalyst.resourcebridge.credential.operations.createcredential.CreateCredentialUseCase;
import tech.flowcatalyst.resourcebridge.credential.operations.createcredential.CredentialIssued;
import tech.flowcatalyst.resourcebridge.credential.operations.deactivatecredential.DeactivateCredentialCommand;
import tech.flowcatalyst.resourcebridge.credential.operations.deactivatecredential.DeactivateCredentialUseCase;
import tech.flowcatalyst.resourcebridge.credential.operations.regeneratecredential.RegenerateCredentialCommand;
import tech.flowcatalyst.resourcebridge.credential.operations.regeneratecredential.RegenerateCredentialUseCase;
import tech.flowcatalyst.resourcebridge.testing.Beans;
import tech.flowcatalyst.resourcebridge.testing.BlogFixture;
import tech.flowcatalyst.resourcebridge.testing.InMemoryUnitOfWork;
import tech.flowcatalyst.resourcebridge.testing.TestConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the credential lifecycle use cases.
 */
@ExtendWith(MockitoExtension.class)
class CreateCredentialUseCaseTest {

    @Mock
    CredentialRepository repository;

    @Mock
    AuditService auditService;

    CredentialService credentialService;
    InMemoryUnitOfWork unitOfWork;
    ExecutionContext context;

    @BeforeEach
    void setUp() {
        credentialService = Beans.wire(new CredentialService(), repository, TestConfig.defaults());
        unitOfWork = new InMemoryUnitOfWork();
        context = BlogFixture.adminContext();
    }

    private CreateCredentialUseCase createUseCase() {
        return Beans.wire(new CreateCredentialUseCase(), repository, credentialService, auditService, unitOfWork);
    }

    // ========================================================================
    // Create
    // ========================================================================

    @Test
    @DisplayName("create should default expiry to 90 days ahead and audit the issue")
    void create_shouldApplyDefaultExpiry() {
        // Arrange
        when(repository.existsByTokenKey(anyString())).thenReturn(false);
        Set<Permission> grants = Set.of(Permission.of("author", PermissionAction.VIEW));
        Instant before = Instant.now();

        // Act
        Result<CredentialIssued> result = createUseCase().execute(
            CreateCredentialCommand.withDefaultExpiry("Production API", "staff-1", grants, Set.of()), context);

        // Assert
        assertThat(result).isInstanceOf(Result.Success.class);
        CredentialIssued issued = ((Result.Success<CredentialIssued>) result).value();
        Credential credential = issued.credential();
        assertThat(credential.id).startsWith("crd_");
        assertThat(credential.expiresAt)
            .isBetween(before.plus(Duration.ofDays(90)), Instant.now().plus(Duration.ofDays(90)));
        assertThat(credential.permissions).isEqualTo(grants);
        assertThat(issued.plaintextToken()).startsWith("mcp_").doesNotContain(credential.secretHash);
        assertThat(issued.toString()).doesNotContain(issued.plaintextToken());
        verify(repository).persist(credential);
        verify(auditService).record(eq(context), eq("credential"), eq(credential.id), anyString(),
            eq(AuditKind.ADDITION), eq("Credential issued"));
    }

    @Test
    @DisplayName("create should leave expiry empty for a never-expiring credential")
    void create_shouldNotExpire_whenNeverExpires() {
        when(repository.existsByTokenKey(anyString())).thenReturn(false);

        Result<CredentialIssued> result = createUseCase().execute(
            CreateCredentialCommand.neverExpiring("Forever", "staff-1", Set.of(), Set.of()), context);

        Credential credential = ((Result.Success<CredentialIssued>) result).value().credential();
        assertThat(credential.expiresAt).isNull();
        assertThat(credential.isValid(Instant.now().plus(Duration.ofDays(10_000)))).isTrue();
    }

    @Test
    @DisplayName("create should reject a blank name and a past expiry")
    void create_shouldValidateInput() {
        Result<CredentialIssued> blank = createUseCase().execute(
            CreateCredentialCommand.withDefaultExpiry(" ", "staff-1", Set.of(), Set.of()), context);
        Result<CredentialIssued> past = createUseCase().execute(
            CreateCredentialCommand.expiringAt("Old", "staff-1", Instant.now().minusSeconds(60), Set.of(), Set.of()),
            context);

        assertThat(((Result.Failure<CredentialIssued>) blank).error().code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(((Result.Failure<CredentialIssued>) past).error().message()).isEqualTo("Expiry must be in the future");
        verify(repository, never()).persist(any());
    }

    // ========================================================================
    // Regenerate / Deactivate
    // ========================================================================

    @Test
    @DisplayName("regenerate should keep the key but replace the secret hash")
    void regenerate_shouldReplaceSecret() {
        Credential credential = new Credential();
        credential.id = "crd_1";
        credential.name = "CI";
        credential.tokenKey = "fixedkey";
        credential.salt = "salt";
        credential.secretHash = "oldhash";
        when(repository.findById("crd_1")).thenReturn(Optional.of(credential));

        Result<CredentialIssued> result = Beans.wire(new RegenerateCredentialUseCase(), repository, credentialService, auditService, unitOfWork)
            .execute(new RegenerateCredentialCommand("crd_1"), context);

        assertThat(result).isInstanceOf(Result.Success.class);
        assertThat(credential.tokenKey).isEqualTo("fixedkey");
        assertThat(credential.secretHash).isNotEqualTo("oldhash");
        assertThat(((Result.Success<CredentialIssued>) result).value().plaintextToken()).startsWith("mcp_fixedkey_");
        verify(repository).update(credential);
    }

    @Test
    @DisplayName("deactivate should mark the credential inactive and audit the change")
    void deactivate_shouldMarkInactive() {
        Credential credential = new Credential();
        credential.id = "crd_1";
        credential.name = "CI";
        when(repository.findById("crd_1")).thenReturn(Optional.of(credential));

        Result<Credential> result = Beans.wire(new DeactivateCredentialUseCase(), repository, auditService, unitOfWork)
            .execute(new DeactivateCredentialCommand("crd_1"), context);

        assertThat(result).isInstanceOf(Result.Success.class);
        assertThat(credential.active).isFalse();
        ArgumentCaptor<AuditKind> kind = ArgumentCaptor.forClass(AuditKind.class);
        verify(auditService).record(eq(context), eq("credential"), eq("crd_1"), anyString(), kind.capture(), anyString());
        assertThat(kind.getValue()).isEqualTo(AuditKind.CHANGE);
    }

    @Test
    @DisplayName("deactivate should fail with not_found for an unknown credential")
    void deactivate_shouldFail_whenUnknown() {
        when(repository.findById("missing")).thenReturn(Optional.empty());

        Result<Credential> result = Beans.wire(new DeactivateCredentialUseCase(), repository, auditService, unitOfWork)
            .execute(new DeactivateCredentialCommand("missing"), context);

        assertThat(((Result.Failure<Credential>) result).error().code()).isEqualTo(ErrorCode.NOT_FOUND);
        verifyNoInteractions(auditService);
    }
}
