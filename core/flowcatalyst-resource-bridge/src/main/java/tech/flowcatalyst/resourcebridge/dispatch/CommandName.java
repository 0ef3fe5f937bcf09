package tech.flowcatalyst.resourcebridge.dispatch;

import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;

import java.util.Optional;

/**
 * A command identifier split into operation and resource name.
 *
 * <p>The split happens at the first underscore, so resource names may
 * contain underscores themselves ("get_blog_post" addresses "blog_post").
 */
public record CommandName(OperationType operation, String resource) {

    public static final char SEPARATOR = '_';

    public static Result<CommandName> parse(String command) {
        if (command == null) {
            return Result.failure(UseCaseError.invalidInput("Command name is required"));
        }
        int separator = command.indexOf(SEPARATOR);
        if (separator <= 0 || separator == command.length() - 1) {
            return Result.failure(UseCaseError.invalidInput("Invalid command: " + command));
        }

        Optional<OperationType> operation = OperationType.fromCode(command.substring(0, separator));
        if (operation.isEmpty()) {
            return Result.failure(UseCaseError.invalidInput("Unknown operation in command: " + command));
        }
        return Result.success(new CommandName(operation.get(), command.substring(separator + 1)));
    }

    public String format() {
        return operation.code() + SEPARATOR + resource;
    }

    @Override
    public String toString() {
        return format();
    }
}
