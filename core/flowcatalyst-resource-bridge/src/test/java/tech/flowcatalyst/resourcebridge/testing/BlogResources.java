package tech.flowcatalyst.resourcebridge.testing;

import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.resource.ChildDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldType;
import tech.flowcatalyst.resourcebridge.resource.RecordAction;
import tech.flowcatalyst.resourcebridge.resource.RelationDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Small blog schema used across the engine and dispatcher tests:
 * authors own articles, articles own comments.
 */
public final class BlogResources {

    private BlogResources() {
    }

    public static class AuthorDescriptor implements ResourceDescriptor {

        @Override
        public String name() {
            return "author";
        }

        @Override
        public String appLabel() {
            return "blog";
        }

        @Override
        public List<FieldDescriptor> fields() {
            return List.of(
                FieldDescriptor.builder("id", FieldType.INTEGER).primaryKey().verboseName("ID").build(),
                FieldDescriptor.builder("name", FieldType.STRING).maxLength(100).build(),
                FieldDescriptor.builder("email", FieldType.EMAIL).maxLength(254).unique().build(),
                FieldDescriptor.builder("bio", FieldType.TEXT).optional().helpText("Short biography").build()
            );
        }

        @Override
        public List<String> searchableFields() {
            return List.of("name", "email");
        }

        @Override
        public List<String> defaultOrdering() {
            return List.of("name");
        }

        @Override
        public List<String> listDisplay() {
            return List.of("name", "email");
        }

        @Override
        public List<ChildDescriptor> childDescriptors() {
            return List.of(new ChildDescriptor("article", "author"));
        }

        @Override
        public List<RelationDescriptor> relations() {
            return List.of(new RelationDescriptor("articles", "article"));
        }

        @Override
        public String displayText(Map<String, Object> record) {
            return String.valueOf(record.get("name"));
        }
    }

    public static class ArticleDescriptor implements ResourceDescriptor {

        private final List<RecordAction> actions;

        public ArticleDescriptor(RecordAction... actions) {
            this.actions = List.of(actions);
        }

        @Override
        public String name() {
            return "article";
        }

        @Override
        public String appLabel() {
            return "blog";
        }

        @Override
        public List<FieldDescriptor> fields() {
            return List.of(
                FieldDescriptor.builder("id", FieldType.INTEGER).primaryKey().verboseName("ID").build(),
                FieldDescriptor.builder("title", FieldType.STRING).maxLength(200).build(),
                FieldDescriptor.builder("status", FieldType.STRING)
                    .maxLength(20)
                    .choice("draft", "Draft")
                    .choice("published", "Published")
                    .defaultValue("draft")
                    .build(),
                FieldDescriptor.foreignKey("author", "author").build(),
                FieldDescriptor.builder("views", FieldType.INTEGER).optional().build()
            );
        }

        @Override
        public List<String> searchableFields() {
            return List.of("title");
        }

        @Override
        public List<String> defaultOrdering() {
            return List.of("id");
        }

        @Override
        public List<String> listFilter() {
            return List.of("status");
        }

        @Override
        public Set<String> readonlyFields() {
            return Set.of("views");
        }

        @Override
        public List<ChildDescriptor> childDescriptors() {
            return List.of(new ChildDescriptor("comment", "article"));
        }

        @Override
        public List<RelationDescriptor> relations() {
            return List.of(new RelationDescriptor("comments", "comment"));
        }

        @Override
        public List<RecordAction> actions() {
            return actions;
        }

        @Override
        public String displayText(Map<String, Object> record) {
            return String.valueOf(record.get("title"));
        }
    }

    public static class CommentDescriptor implements ResourceDescriptor {

        @Override
        public String name() {
            return "comment";
        }

        @Override
        public List<FieldDescriptor> fields() {
            return List.of(
                FieldDescriptor.builder("id", FieldType.INTEGER).primaryKey().build(),
                FieldDescriptor.foreignKey("article", "article").build(),
                FieldDescriptor.builder("body", FieldType.TEXT).build(),
                FieldDescriptor.builder("approved", FieldType.BOOLEAN).defaultValue(false).build()
            );
        }

        @Override
        public List<String> defaultOrdering() {
            return List.of("id");
        }
    }

    /**
     * Resource that leaves access control to the gate's undeclared-policy default.
     */
    public static class NoteDescriptor implements ResourceDescriptor {

        @Override
        public String name() {
            return "note";
        }

        @Override
        public List<FieldDescriptor> fields() {
            return List.of(
                FieldDescriptor.builder("id", FieldType.INTEGER).primaryKey().build(),
                FieldDescriptor.builder("text", FieldType.STRING).maxLength(50).build()
            );
        }

        @Override
        public boolean declaresPermissionPolicy() {
            return false;
        }
    }

    /**
     * Sets the status of every selected article to "published".
     */
    public static class PublishAction implements RecordAction {

        private ResourceStore articles;

        public void bind(ResourceStore articles) {
            this.articles = articles;
        }

        @Override
        public String name() {
            return "publish";
        }

        @Override
        public String description() {
            return "Publish selected articles";
        }

        @Override
        public Optional<String> apply(List<Map<String, Object>> records, ExecutionContext context) throws Exception {
            for (Map<String, Object> record : records) {
                articles.update(record.get("id"), Map.of("status", "published"));
            }
            return Optional.of(records.size() + " published");
        }
    }
}
