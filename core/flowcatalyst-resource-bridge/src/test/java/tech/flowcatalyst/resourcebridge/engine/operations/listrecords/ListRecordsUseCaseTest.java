package tech.flowcatalyst.resourcebridge.engine.operations.listrecords;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.testing.BlogFixture;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static tech.flowcatalyst.resourcebridge.testing.ResultAssertions.*;

/**
 * Tests for ListRecordsUseCase over the in-memory blog store.
 */
class ListRecordsUseCaseTest {

    BlogFixture blog;

    @BeforeEach
    void setUp() {
        blog = new BlogFixture();
        for (int i = 1; i <= 5; i++) {
            blog.seedAuthor("Writer " + i, "writer" + i + "@example.com");
        }
        blog.seedAuthor("Editor", "editor@example.com");
    }

    private RecordList list(ListRecordsCommand command) {
        return assertSuccess(blog.listUseCase.execute(blog.author, command, BlogFixture.adminContext()));
    }

    @Test
    @DisplayName("execute should count the page and the total separately")
    void execute_shouldReportPageAndTotal() {
        RecordList result = list(new ListRecordsCommand(Map.of(), "writer", List.of(), 2, 0));

        assertThat(result.count()).isEqualTo(2);
        assertThat(result.totalCount()).isEqualTo(5);
        assertThat(result.results()).extracting(r -> r.get("name")).containsExactly("Writer 1", "Writer 2");
    }

    @Test
    @DisplayName("execute should apply filters, explicit ordering and offset")
    void execute_shouldFilterOrderAndOffset() {
        RecordList result = list(new ListRecordsCommand(
            Map.of("name__istartswith", "writer"), null, List.of("-name"), 2, 1));

        assertThat(result.totalCount()).isEqualTo(5);
        assertThat(result.results()).extracting(r -> r.get("name")).containsExactly("Writer 4", "Writer 3");
    }

    @Test
    @DisplayName("execute should fall back to the configured default limit")
    void execute_shouldUseDefaultLimit() {
        blog.config.defaultListLimit = 3;

        RecordList result = list(ListRecordsCommand.all());

        assertThat(result.count()).isEqualTo(3);
        assertThat(result.totalCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("execute should ignore unknown filter fields")
    void execute_shouldIgnoreUnknownFilters() {
        RecordList result = list(new ListRecordsCommand(Map.of("nickname", "x"), null, null, null, 0));

        assertThat(result.totalCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("execute should reject negative limit or offset")
    void execute_shouldRejectNegativePaging() {
        UseCaseError error = assertFailure(blog.listUseCase.execute(blog.author,
            new ListRecordsCommand(Map.of(), null, null, -1, 0), BlogFixture.adminContext()));

        assertThat(error.code()).isEqualTo(ErrorCode.INVALID_INPUT);
        assertThat(error.message()).isEqualTo("limit and offset must be non-negative integers");
    }

    @Test
    @DisplayName("execute should reject filter values the field cannot hold")
    void execute_shouldRejectInvalidFilterValue() {
        UseCaseError error = assertFailure(blog.listUseCase.execute(blog.article,
            new ListRecordsCommand(Map.of("views__gt", "many"), null, null, null, 0), BlogFixture.adminContext()));

        assertThat(error.code()).isEqualTo(ErrorCode.INVALID_INPUT);
        assertThat(error.message()).startsWith("Invalid filter value: ");
    }
}
