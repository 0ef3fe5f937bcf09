package tech.flowcatalyst.resourcebridge.engine.operations.describeresource;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.resourcebridge.testing.BlogFixture;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static tech.flowcatalyst.resourcebridge.testing.ResultAssertions.*;

class DescribeResourceUseCaseTest {

    private final BlogFixture blog = new BlogFixture();

    @Test
    @DisplayName("execute should describe fields, relationships and admin configuration")
    void execute_shouldDescribeArticle() {
        ResourceDescription description = assertSuccess(blog.describeUseCase.execute(blog.article, BlogFixture.adminContext()));

        assertThat(description.modelName()).isEqualTo("article");
        assertThat(description.appLabel()).isEqualTo("blog");
        assertThat(description.fields()).extracting(ResourceDescription.FieldInfo::name)
            .containsExactly("id", "title", "status", "author", "views");

        ResourceDescription.FieldInfo id = description.fields().get(0);
        assertThat(id.primaryKey()).isTrue();
        assertThat(id.editable()).isFalse();
        assertThat(id.required()).isFalse();

        ResourceDescription.FieldInfo status = description.fields().get(2);
        assertThat(status.defaultValue()).isEqualTo("draft");
        assertThat(status.choices()).extracting(ResourceDescription.Choice::value).containsExactly("draft", "published");
        assertThat(status.required()).isFalse();

        assertThat(description.fields().get(1).required()).isTrue();
        assertThat(description.fields().get(1).maxLength()).isEqualTo(200);
        assertThat(description.relationships()).containsExactly(
            new ResourceDescription.RelationshipInfo("author", "foreign_key", "author"));
        assertThat(description.adminConfig().readonlyFields()).isEqualTo(List.of("views"));
        assertThat(description.adminConfig().inlines()).containsExactly(
            new ResourceDescription.InlineInfo("comment", "article"));
    }
}
