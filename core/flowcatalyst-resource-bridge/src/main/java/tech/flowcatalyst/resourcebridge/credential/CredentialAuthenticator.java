package tech.flowcatalyst.resourcebridge.credential;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGroup;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGroupRepository;
import tech.flowcatalyst.resourcebridge.authorization.Principal;

import java.util.List;
import java.util.Optional;

/**
 * Turns a bearer token into an authenticated {@link Principal}.
 *
 * <p>Groups are loaded on every authentication, so a permission added to a
 * group applies to the next request without touching the credential.
 */
@ApplicationScoped
public class CredentialAuthenticator {

    private static final Logger LOG = Logger.getLogger(CredentialAuthenticator.class);

    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    CredentialService credentialService;

    @Inject
    PermissionGroupRepository groupRepository;

    /**
     * Authenticate a token, with or without the "Bearer " scheme prefix.
     *
     * @return the principal, or empty for any kind of rejection
     */
    public Optional<Principal> authenticate(String bearer) {
        if (bearer == null || bearer.isBlank()) {
            return Optional.empty();
        }
        String token = bearer.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
            ? bearer.substring(BEARER_PREFIX.length()).trim()
            : bearer.trim();

        Optional<Credential> verified = credentialService.verify(token);
        if (verified.isEmpty()) {
            return Optional.empty();
        }

        Credential credential = verified.get();
        credentialService.markUsed(credential);

        return Optional.of(toPrincipal(credential));
    }

    Principal toPrincipal(Credential credential) {
        List<PermissionGroup> groups = credential.groupNames.isEmpty()
            ? List.of()
            : groupRepository.findByNames(credential.groupNames);

        if (groups.size() < credential.groupNames.size()) {
            LOG.debugf("Credential [%s] references %d unknown group(s)",
                credential.id, credential.groupNames.size() - groups.size());
        }

        return new Principal(
            credential.id,
            credential.ownerPrincipalId,
            credential.name,
            credential.permissions,
            groups
        );
    }
}
