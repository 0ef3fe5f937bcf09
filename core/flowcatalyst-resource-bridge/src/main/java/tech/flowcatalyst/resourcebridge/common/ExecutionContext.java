package tech.flowcatalyst.resourcebridge.common;

import tech.flowcatalyst.resourcebridge.authorization.Principal;
import tech.flowcatalyst.resourcebridge.shared.TsidGenerator;

import java.time.Instant;

/**
 * Context for one command execution.
 *
 * <p>Carries the tracing IDs and the principal through the use cases of a
 * single invocation. Nothing in it outlives the invocation.
 *
 * @param executionId   Unique ID for this execution (generated)
 * @param correlationId ID for distributed tracing (usually from the transport)
 * @param principal     The authenticated principal, or null when anonymous
 * @param initiatedAt   When the execution was initiated
 */
public record ExecutionContext(
    String executionId,
    String correlationId,
    Principal principal,
    Instant initiatedAt
) {

    /**
     * Create a new execution context for a fresh command.
     *
     * <p>The correlation ID starts out equal to the execution ID.
     *
     * @param principal The principal performing the command, may be null
     * @return A new execution context
     */
    public static ExecutionContext create(Principal principal) {
        String execId = "exec-" + TsidGenerator.generateRaw();
        return new ExecutionContext(execId, execId, principal, Instant.now());
    }

    /**
     * Create a new execution context with a correlation ID supplied by the caller.
     *
     * @param principal     The principal performing the command, may be null
     * @param correlationId The correlation ID to use
     * @return A new execution context
     */
    public static ExecutionContext withCorrelation(Principal principal, String correlationId) {
        return new ExecutionContext(
            "exec-" + TsidGenerator.generateRaw(),
            correlationId,
            principal,
            Instant.now()
        );
    }

    public boolean isAnonymous() {
        return principal == null;
    }

    /**
     * Principal ID recorded in audit entries, or null when nothing should be audited.
     */
    public String auditPrincipalId() {
        return principal != null ? principal.auditPrincipalId() : null;
    }
}
