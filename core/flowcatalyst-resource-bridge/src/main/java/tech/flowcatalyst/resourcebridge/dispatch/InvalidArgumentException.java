package tech.flowcatalyst.resourcebridge.dispatch;

/**
 * A command argument has the wrong shape. Its message is safe to return to the caller.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
