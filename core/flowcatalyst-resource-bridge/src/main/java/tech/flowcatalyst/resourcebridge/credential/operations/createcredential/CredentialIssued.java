package tech.flowcatalyst.resourcebridge.credential.operations.createcredential;

import lombok.Builder;
import tech.flowcatalyst.resourcebridge.credential.Credential;

/**
 * A credential together with its plaintext token.
 *
 * <p>The token is only available here, right after issuing or regenerating.
 *
 * @param credential     The stored credential
 * @param plaintextToken The full token to hand to the client, shown only once
 */
@Builder
public record CredentialIssued(
    Credential credential,
    String plaintextToken
) {

    @Override
    public String toString() {
        return "CredentialIssued[credential=" + credential + "]";
    }
}
