package tech.flowcatalyst.resourcebridge.credential.operations.deactivatecredential;

/**
 * Command to deactivate a credential. Deactivation is reversible.
 *
 * @param credentialId The credential ID
 */
public record DeactivateCredentialCommand(String credentialId) {}
