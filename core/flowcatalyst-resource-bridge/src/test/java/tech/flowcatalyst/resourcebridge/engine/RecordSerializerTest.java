package tech.flowcatalyst.resourcebridge.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldType;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.testing.BlogResources;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for RecordSerializer and ForeignKeyNormalizer.
 */
class RecordSerializerTest {

    private static final ResourceDescriptor ACCOUNT = new ResourceDescriptor() {
        @Override
        public String name() {
            return "account";
        }

        @Override
        public List<FieldDescriptor> fields() {
            return List.of(
                FieldDescriptor.builder("id", FieldType.INTEGER).primaryKey().build(),
                FieldDescriptor.builder("username", FieldType.STRING).build(),
                FieldDescriptor.builder("password", FieldType.STRING).build(),
                FieldDescriptor.builder("email", FieldType.EMAIL).build()
            );
        }

        @Override
        public List<String> visibleFields() {
            return List.of("email", "username", "password");
        }

        @Override
        public Set<String> excludedFields() {
            return Set.of("password");
        }
    };

    @Test
    @DisplayName("serialize should put the primary key first and honour include and exclude lists")
    void serialize_shouldApplyVisibility() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("username", "ada");
        record.put("password", "hash");
        record.put("email", "ada@example.com");
        record.put("id", 1L);

        Map<String, Object> serialized = RecordSerializer.serialize(ACCOUNT, record);

        assertThat(serialized.keySet()).containsExactly("id", "email", "username");
    }

    @Test
    @DisplayName("serialize should use declaration order when no include list is set")
    void serialize_shouldUseDeclarationOrder() {
        Map<String, Object> record = Map.of("email", "a@b.co", "name", "Ada", "id", 1L, "bio", "x");

        assertThat(RecordSerializer.serialize(new BlogResources.AuthorDescriptor(), record).keySet())
            .containsExactly("id", "name", "email", "bio");
    }

    @Test
    @DisplayName("normalize should rewrite column-style keys unless the logical name is present")
    void normalize_shouldRewriteForeignKeyColumns() {
        BlogResources.ArticleDescriptor article = new BlogResources.ArticleDescriptor();
        Map<String, Object> both = new LinkedHashMap<>();
        both.put("author_id", 1);
        both.put("author", 2);

        assertThat(ForeignKeyNormalizer.normalize(article, Map.of("author_id", 1))).isEqualTo(Map.of("author", 1));
        assertThat(ForeignKeyNormalizer.normalize(article, both)).isEqualTo(Map.of("author", 2));
        assertThat(ForeignKeyNormalizer.normalize(article, Map.of("title_id", 1))).isEqualTo(Map.of("title_id", 1));
    }
}
