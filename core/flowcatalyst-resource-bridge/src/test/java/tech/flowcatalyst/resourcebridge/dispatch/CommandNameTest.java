package tech.flowcatalyst.resourcebridge.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;

import static org.assertj.core.api.Assertions.*;
import static tech.flowcatalyst.resourcebridge.testing.ResultAssertions.*;

class CommandNameTest {

    @Test
    @DisplayName("parse should split at the first underscore")
    void parse_shouldSplitAtFirstUnderscore() {
        assertThat(assertSuccess(CommandName.parse("list_author")))
            .isEqualTo(new CommandName(OperationType.LIST, "author"));
        assertThat(assertSuccess(CommandName.parse("get_blog_post")))
            .isEqualTo(new CommandName(OperationType.GET, "blog_post"));
        assertThat(assertSuccess(CommandName.parse("bulk_author")).operation()).isEqualTo(OperationType.BULK);
    }

    @Test
    @DisplayName("parse should reject missing, malformed and unknown commands")
    void parse_shouldRejectBadCommands() {
        UseCaseError missing = assertFailure(CommandName.parse(null));
        UseCaseError malformed = assertFailure(CommandName.parse("list"));
        UseCaseError trailing = assertFailure(CommandName.parse("list_"));
        UseCaseError unknown = assertFailure(CommandName.parse("purge_author"));

        assertThat(missing.message()).isEqualTo("Command name is required");
        assertThat(malformed.message()).isEqualTo("Invalid command: list");
        assertThat(trailing.message()).isEqualTo("Invalid command: list_");
        assertThat(unknown.message()).isEqualTo("Unknown operation in command: purge_author");
        assertThat(unknown.code()).isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("format should rebuild the command identifier")
    void format_shouldRoundTrip() {
        assertThat(new CommandName(OperationType.AUTOCOMPLETE, "article").format()).isEqualTo("autocomplete_article");
    }
}
