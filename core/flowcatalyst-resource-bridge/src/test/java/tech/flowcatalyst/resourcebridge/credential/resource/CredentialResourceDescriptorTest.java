package tech.flowcatalyst.resourcebridge.credential.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.dispatch.CommandDescriptor;
import tech.flowcatalyst.resourcebridge.engine.QueryTranslator;
import tech.flowcatalyst.resourcebridge.engine.operations.describeresource.ResourceDescription;
import tech.flowcatalyst.resourcebridge.engine.operations.listrecords.ListRecordsCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.listrecords.RecordList;
import tech.flowcatalyst.resourcebridge.engine.operations.updaterecord.UpdateRecordCommand;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.testing.BlogFixture;
import tech.flowcatalyst.resourcebridge.testing.InMemoryResourceStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static tech.flowcatalyst.resourcebridge.testing.ResultAssertions.*;

/**
 * The key, hash and salt columns must stay unreachable through every
 * generic operation, not only serialization.
 */
class CredentialResourceDescriptorTest {

    private final CredentialResourceDescriptor descriptor = new CredentialResourceDescriptor();

    BlogFixture blog;
    RegisteredResource credential;
    Object firstId;

    @BeforeEach
    void setUp() throws Exception {
        blog = new BlogFixture();
        InMemoryResourceStore store = new InMemoryResourceStore(blog.database, descriptor);
        blog.registry.register(descriptor, store);
        credential = blog.registry.find(CredentialResourceDescriptor.NAME).orElseThrow();

        firstId = store.insert(row("ci-deploy", "9f86d081884c7d65", "Ab3kL9", Instant.parse("2026-01-01T00:00:00Z")));
        store.insert(row("nightly-export", "2c26b46b68ffc68f", "Zq7pX2", Instant.parse("2026-02-01T00:00:00Z")));
    }

    private static Map<String, Object> row(String name, String secretHash, String tokenKey, Instant createdAt) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        row.put("token_key", tokenKey);
        row.put("secret_hash", secretHash);
        row.put("salt", "c2FsdA==");
        row.put("active", true);
        row.put("created_at", createdAt);
        row.put("updated_at", createdAt);
        return row;
    }

    private RecordList list(ListRecordsCommand command) {
        return assertSuccess(blog.listUseCase.execute(credential, command, BlogFixture.adminContext()));
    }

    @Test
    @DisplayName("filters on secret columns should be dropped rather than narrowing results")
    void list_shouldIgnoreSecretFilters() {
        RecordList result = list(new ListRecordsCommand(
            Map.of("secret_hash__istartswith", "9f86", "token_key", "Ab3kL9"), null, List.of(), null, 0));

        assertThat(result.totalCount()).isEqualTo(2);
        assertThat(result.results()).allSatisfy(record ->
            assertThat(record).doesNotContainKeys("token_key", "secret_hash", "salt"));
    }

    @Test
    @DisplayName("ordering by secret columns should be dropped in favour of the default ordering")
    void list_shouldIgnoreSecretOrdering() {
        RecordList byHash = list(new ListRecordsCommand(Map.of(), null, List.of("secret_hash", "salt"), null, 0));

        assertThat(byHash.results()).extracting(r -> r.get("name")).containsExactly("nightly-export", "ci-deploy");
        assertThat(QueryTranslator.ordering(descriptor, List.of("-token_key", "name"))).hasSize(1);
        assertThat(QueryTranslator.filters(descriptor, Map.of("salt__contains", "c2", "name", "ci-deploy"))).hasSize(1);
    }

    @Test
    @DisplayName("describe should omit secret columns from fields and admin configuration")
    void describe_shouldOmitSecrets() {
        ResourceDescription description = assertSuccess(blog.describeUseCase.execute(credential, BlogFixture.adminContext()));

        assertThat(description.fields()).extracting(ResourceDescription.FieldInfo::name)
            .doesNotContain("token_key", "secret_hash", "salt")
            .contains("id", "name", "active");
        assertThat(description.adminConfig().readonlyFields()).doesNotContain("token_key", "secret_hash", "salt");
        assertThat(description.adminConfig().searchFields()).containsExactly("name");
    }

    @Test
    @DisplayName("update schema should not offer secret columns")
    void updateSchema_shouldOmitSecrets() {
        CommandDescriptor update = blog.catalog.listCommands().stream()
            .filter(c -> c.name().equals("update_credential"))
            .findFirst()
            .orElseThrow();

        List<String> names = new ArrayList<>();
        JsonNode data = update.inputSchema().get("properties").get("data").get("properties");
        data.fieldNames().forEachRemaining(names::add);

        assertThat(names).contains("name", "active").doesNotContain("token_key", "secret_hash", "salt");
    }

    @Test
    @DisplayName("update should reject writes to secret columns as unknown fields")
    void update_shouldRejectSecretColumns() {
        UseCaseError error = assertFailure(blog.updateUseCase.execute(credential,
            new UpdateRecordCommand(firstId, Map.of("secret_hash", "0000"), Map.of()),
            BlogFixture.adminContext()));

        assertThat(error.code()).isEqualTo(ErrorCode.INVALID_FIELD);
    }
}
