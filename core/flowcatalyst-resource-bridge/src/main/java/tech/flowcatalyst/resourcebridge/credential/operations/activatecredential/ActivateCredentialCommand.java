package tech.flowcatalyst.resourcebridge.credential.operations.activatecredential;

/**
 * Command to activate a credential.
 *
 * @param credentialId The credential ID
 */
public record ActivateCredentialCommand(String credentialId) {}
