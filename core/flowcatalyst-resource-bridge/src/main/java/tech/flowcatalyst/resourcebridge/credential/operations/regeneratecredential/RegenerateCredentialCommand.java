package tech.flowcatalyst.resourcebridge.credential.operations.regeneratecredential;

/**
 * Command to replace a credential's secret.
 *
 * @param credentialId The credential ID
 */
public record RegenerateCredentialCommand(String credentialId) {}
