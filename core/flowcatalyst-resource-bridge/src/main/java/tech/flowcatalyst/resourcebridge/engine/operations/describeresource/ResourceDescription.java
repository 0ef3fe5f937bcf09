package tech.flowcatalyst.resourcebridge.engine.operations.describeresource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Schema and admin configuration of a resource.
 */
public record ResourceDescription(
    @JsonProperty("model_name") String modelName,
    @JsonProperty("verbose_name") String verboseName,
    @JsonProperty("verbose_name_plural") String verboseNamePlural,
    @JsonProperty("app_label") String appLabel,
    List<FieldInfo> fields,
    List<RelationshipInfo> relationships,
    @JsonProperty("admin_config") AdminConfig adminConfig
) {

    /**
     * Field metadata. Optional attributes are omitted when unset; primary_key
     * and unique appear only when true.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FieldInfo(
        String name,
        String type,
        @JsonProperty("verbose_name") String verboseName,
        boolean required,
        @JsonProperty("max_length") Integer maxLength,
        @JsonProperty("help_text") String helpText,
        List<Choice> choices,
        @JsonProperty("default") Object defaultValue,
        @JsonProperty("primary_key") Boolean primaryKey,
        Boolean unique,
        boolean editable
    ) {}

    public record Choice(Object value, String label) {}

    public record RelationshipInfo(
        String name,
        String type,
        @JsonProperty("related_model") String relatedModel
    ) {}

    public record AdminConfig(
        @JsonProperty("list_display") List<String> listDisplay,
        @JsonProperty("list_filter") List<String> listFilter,
        @JsonProperty("search_fields") List<String> searchFields,
        List<String> ordering,
        @JsonProperty("readonly_fields") List<String> readonlyFields,
        List<InlineInfo> inlines
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InlineInfo(
        String model,
        @JsonProperty("fk_name") String fkName
    ) {}
}
