package tech.flowcatalyst.resourcebridge.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.resourcebridge.authorization.Permission;
import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;
import tech.flowcatalyst.resourcebridge.authorization.Principal;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkOperation;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkResult;
import tech.flowcatalyst.resourcebridge.engine.operations.createrecord.RecordCreated;
import tech.flowcatalyst.resourcebridge.engine.operations.findresources.ResourceCatalog;
import tech.flowcatalyst.resourcebridge.engine.operations.listrecords.RecordList;
import tech.flowcatalyst.resourcebridge.testing.BlogFixture;
import tech.flowcatalyst.resourcebridge.testing.TestConfig;

import java.sql.SQLNonTransientConnectionException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CommandDispatcher")
class CommandDispatcherTest {

    BlogFixture blog;

    @BeforeEach
    void setUp() {
        blog = new BlogFixture();
    }

    private OperationResult dispatch(Principal principal, String command, Map<String, Object> args) {
        return blog.dispatcher.dispatch(principal, command, args);
    }

    // ==================== Routing ====================

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("find_models should list resources without a resource check")
        void findModels_shouldListResources() {
            OperationResult result = dispatch(BlogFixture.admin(), "find_models", Map.of());

            assertThat(result.success()).isTrue();
            assertThat(((ResourceCatalog) result.payload()).count()).isEqualTo(4);
        }

        @Test
        @DisplayName("dispatch should fail with not_found for an unregistered resource")
        void dispatch_shouldFail_whenResourceUnknown() {
            OperationResult result = dispatch(BlogFixture.admin(), "list_widget", Map.of());

            assertThat(result.isFailure()).isTrue();
            assertThat(result.code()).isEqualTo(ErrorCode.NOT_FOUND);
            assertThat(result.error()).isEqualTo("Resource 'widget' not found");
        }

        @Test
        @DisplayName("dispatch should fail with invalid_input for a malformed command")
        void dispatch_shouldFail_whenCommandMalformed() {
            OperationResult missing = dispatch(BlogFixture.admin(), null, Map.of());
            OperationResult unknown = dispatch(BlogFixture.admin(), "purge_author", null);

            assertThat(missing.code()).isEqualTo(ErrorCode.INVALID_INPUT);
            assertThat(unknown.error()).isEqualTo("Unknown operation in command: purge_author");
        }

        @Test
        @DisplayName("dispatch should turn malformed arguments into invalid_input")
        void dispatch_shouldFail_whenArgumentMalformed() {
            OperationResult result = dispatch(BlogFixture.admin(), "list_author", Map.of("limit", "ten"));

            assertThat(result.code()).isEqualTo(ErrorCode.INVALID_INPUT);
            assertThat(result.error()).isEqualTo("limit must be an integer");
        }

        @Test
        @DisplayName("dispatch should never throw when storage fails")
        void dispatch_shouldTranslateStorageFailure() {
            blog.authors.failWith(new SQLNonTransientConnectionException("connection refused", "08001"));

            OperationResult result = dispatch(BlogFixture.admin(), "list_author", Map.of());

            assertThat(result.isFailure()).isTrue();
            assertThat(result.code()).isEqualTo(ErrorCode.DATABASE_UNAVAILABLE);
        }
    }

    // ==================== Authorization ====================

    @Nested
    @DisplayName("authorization")
    class Authorization {

        @Test
        @DisplayName("dispatch should deny an operation the principal lacks")
        void dispatch_shouldDeny_whenPermissionMissing() {
            long id = blog.seedAuthor("Ada", "ada@example.com");
            Principal viewer = BlogFixture.principalWith(Permission.of("author", PermissionAction.VIEW));

            OperationResult result = dispatch(viewer, "delete_author", Map.of("id", id));

            assertThat(result.code()).isEqualTo(ErrorCode.PERMISSION_DENIED);
            assertThat(result.error()).isEqualTo("Permission denied: cannot delete author");
            assertThat(result.details()).containsEntry("action", "delete").containsEntry("resource", "author");
            assertThat(blog.authors.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("dispatch should deny anonymous callers when anonymous access is off")
        void dispatch_shouldDenyAnonymous_whenStrict() {
            BlogFixture strict = new BlogFixture(TestConfig.strict());

            OperationResult result = strict.dispatcher.dispatch(null, "list_author", Map.of());

            assertThat(result.code()).isEqualTo(ErrorCode.PERMISSION_DENIED);
        }

        @Test
        @DisplayName("bulk should check the action of its sub-operation")
        void bulk_shouldCheckSubOperationAction() {
            Principal adder = BlogFixture.principalWith(Permission.of("author", PermissionAction.ADD));

            OperationResult created = dispatch(adder, "bulk_author", Map.of(
                "operation", "create",
                "items", List.of(Map.of("name", "Ada", "email", "ada@example.com"))));
            OperationResult deleted = dispatch(adder, "bulk_author", Map.of(
                "operation", "delete",
                "items", List.of(1)));

            assertThat(created.success()).isTrue();
            assertThat(((BulkResult) created.payload()).successCount()).isEqualTo(1);
            assertThat(deleted.code()).isEqualTo(ErrorCode.PERMISSION_DENIED);
            assertThat(deleted.error()).isEqualTo("Permission denied: cannot delete author");
        }

        @Test
        @DisplayName("bulk should validate the operation before checking permission")
        void bulk_shouldValidateOperation() {
            Principal nobody = BlogFixture.principalWith();

            OperationResult missing = dispatch(nobody, "bulk_author", Map.of("items", List.of()));
            OperationResult invalid = dispatch(nobody, "bulk_author", Map.of("operation", "upsert"));

            assertThat(missing.code()).isEqualTo(ErrorCode.VALIDATION_ERROR);
            assertThat(missing.error()).isEqualTo(BulkOperation.REQUIRED_MESSAGE);
            assertThat(invalid.error()).isEqualTo("operation must be 'create', 'update', or 'delete'");
        }
    }

    // ==================== End to end ====================

    @Test
    @DisplayName("create then list should round trip through the dispatcher")
    void createThenList_shouldSeeNewRecord() {
        OperationResult created = dispatch(BlogFixture.admin(), "create_author",
            Map.of("data", Map.of("name", "Grace", "email", "grace@example.com")));
        OperationResult listed = dispatch(BlogFixture.admin(), "list_author", Map.of("search", "grace"));

        assertThat(created.success()).isTrue();
        RecordCreated record = (RecordCreated) created.payload();
        assertThat(record.object()).containsEntry("name", "Grace");

        RecordList list = (RecordList) listed.payload();
        assertThat(list.totalCount()).isEqualTo(1);
        assertThat(list.results().get(0)).containsEntry("id", record.id());
        assertThat(blog.auditLogs.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("dispatchAsync should complete with the same outcome")
    void dispatchAsync_shouldComplete() {
        OperationResult result = blog.dispatcher
            .dispatchAsync(BlogFixture.admin(), "describe_author", Map.of())
            .await().indefinitely();

        assertThat(result.success()).isTrue();
    }
}
