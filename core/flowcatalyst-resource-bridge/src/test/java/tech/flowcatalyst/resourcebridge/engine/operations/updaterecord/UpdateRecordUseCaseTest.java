package tech.flowcatalyst.resourcebridge.engine.operations.updaterecord;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditLog;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.testing.BlogFixture;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static tech.flowcatalyst.resourcebridge.testing.ResultAssertions.*;

/**
 * Tests for UpdateRecordUseCase, including inline child changes.
 */
class UpdateRecordUseCaseTest {

    BlogFixture blog;
    long authorId;

    @BeforeEach
    void setUp() {
        blog = new BlogFixture();
        authorId = blog.seedAuthor("Ada", "ada@example.com");
    }

    private static Map<String, Object> item(Object... keyValues) {
        Map<String, Object> item = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            item.put((String) keyValues[i], keyValues[i + 1]);
        }
        return item;
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        @DisplayName("execute should apply the change and write a change entry")
        void execute_shouldUpdateAndAudit() {
            RecordUpdated updated = assertSuccess(blog.updateUseCase.execute(blog.author,
                UpdateRecordCommand.of(authorId, Map.of("name", "Ada Lovelace")), BlogFixture.adminContext()));

            assertThat(updated.object()).containsEntry("name", "Ada Lovelace").containsEntry("email", "ada@example.com");
            assertThat(updated.inlines()).isNull();

            AuditLog entry = blog.auditLogs.ofKind(AuditKind.CHANGE).get(0);
            assertThat(entry.objectRepr).isEqualTo("Ada Lovelace");
            assertThat(entry.changeMessage).isEqualTo("Changed via MCP: {\"name\":\"Ada Lovelace\"}");
        }

        @Test
        @DisplayName("execute should change nothing when a readonly field is included")
        void execute_shouldRejectReadonly() {
            long articleId = blog.seedArticle("Draft", authorId);

            UseCaseError error = assertFailure(blog.updateUseCase.execute(blog.article,
                UpdateRecordCommand.of(articleId, Map.of("title", "Changed", "views", 100)), BlogFixture.adminContext()));

            assertThat(error.code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
            assertThat(blog.row(blog.articles, articleId)).containsEntry("title", "Draft").containsEntry("views", 0L);
            assertThat(blog.auditLogs.size()).isZero();
        }

        @Test
        @DisplayName("execute should change nothing when an unknown field is included")
        void execute_shouldRejectUnknownField() {
            UseCaseError error = assertFailure(blog.updateUseCase.execute(blog.author,
                UpdateRecordCommand.of(authorId, Map.of("name", "X", "nickname", "x")), BlogFixture.adminContext()));

            assertThat(error.code()).isEqualTo(ErrorCode.INVALID_FIELD);
            assertThat(blog.row(blog.authors, authorId)).containsEntry("name", "Ada");
        }

        @Test
        @DisplayName("execute should fail with not_found for a missing record")
        void execute_shouldFail_whenMissing() {
            UseCaseError error = assertFailure(blog.updateUseCase.execute(blog.author,
                UpdateRecordCommand.of(42, Map.of("name", "X")), BlogFixture.adminContext()));

            assertThat(error.code()).isEqualTo(ErrorCode.NOT_FOUND);
            assertThat(error.message()).isEqualTo("author not found");
        }

        @Test
        @DisplayName("execute should roll back when the new value collides with a unique one")
        void execute_shouldRollBack_whenDuplicate() {
            blog.seedAuthor("Grace", "grace@example.com");

            UseCaseError error = assertFailure(blog.updateUseCase.execute(blog.author,
                UpdateRecordCommand.of(authorId, Map.of("email", "grace@example.com")), BlogFixture.adminContext()));

            assertThat(error.code()).isEqualTo(ErrorCode.DUPLICATE_ENTRY);
            assertThat(blog.row(blog.authors, authorId)).containsEntry("email", "ada@example.com");
            assertThat(blog.auditLogs.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Inlines")
    class Inlines {

        @Test
        @DisplayName("execute should create, update and delete children of the parent")
        void execute_shouldApplyInlineChanges() {
            // Arrange
            long kept = blog.seedArticle("Kept", authorId);
            long removed = blog.seedArticle("Removed", authorId);
            Map<String, List<Map<String, Object>>> inlines = Map.of("article", List.of(
                item("title", "Brand new"),
                item("id", kept, "title", "Renamed"),
                item("id", removed, "_delete", true)
            ));

            // Act
            RecordUpdated updated = assertSuccess(blog.updateUseCase.execute(blog.author,
                new UpdateRecordCommand(authorId, Map.of(), inlines), BlogFixture.adminContext()));

            // Assert
            InlineResults results = updated.inlines();
            assertThat(results.created()).hasSize(1);
            assertThat(results.updated()).containsExactly(new InlineResults.ChildChange("article", kept));
            assertThat(results.deleted()).containsExactly(new InlineResults.ChildChange("article", removed));
            assertThat(results.errors()).isEmpty();

            Object createdId = results.created().get(0).id();
            assertThat(blog.row(blog.articles, (Long) createdId)).containsEntry("author", authorId).containsEntry("status", "draft");
            assertThat(blog.row(blog.articles, kept)).containsEntry("title", "Renamed");
            assertThat(blog.articles.findById(removed)).isEmpty();
            assertThat(blog.auditLogs.all().get(0).changeMessage).isEqualTo("Updated inlines: [article]");
        }

        @Test
        @DisplayName("execute should report a failing child and keep the other changes")
        void execute_shouldIsolateFailingChild() {
            long other = blog.seedAuthor("Grace", "grace@example.com");
            long foreign = blog.seedArticle("Not yours", other);
            Map<String, List<Map<String, Object>>> inlines = Map.of("article", List.of(
                item("title", "x".repeat(300)),
                item("id", foreign, "title", "Stolen"),
                item("title", "Valid")
            ));

            RecordUpdated updated = assertSuccess(blog.updateUseCase.execute(blog.author,
                new UpdateRecordCommand(authorId, Map.of("bio", "Mathematician"), inlines), BlogFixture.adminContext()));

            InlineResults results = updated.inlines();
            assertThat(results.created()).hasSize(1);
            assertThat(results.errors()).hasSize(2);
            assertThat(results.errors().get(0).code()).isEqualTo("validation_error");
            assertThat(results.errors().get(1).error()).isEqualTo("article not found");
            assertThat(blog.row(blog.articles, foreign)).containsEntry("title", "Not yours");
            assertThat(blog.row(blog.authors, authorId)).containsEntry("bio", "Mathematician");
            assertThat(blog.unitOfWork.savepointRollbacks).isEqualTo(2);
        }

        @Test
        @DisplayName("execute should report an undeclared inline name")
        void execute_shouldReportUnknownInline() {
            RecordUpdated updated = assertSuccess(blog.updateUseCase.execute(blog.author,
                new UpdateRecordCommand(authorId, Map.of(), Map.of("comment", List.of(item("body", "hi")))),
                BlogFixture.adminContext()));

            assertThat(updated.inlines().errors()).containsExactly(
                new InlineResults.ChildError("comment", null, "Unknown inline: comment", "validation_error"));
            assertThat(blog.comments.count()).isZero();
        }
    }
}
