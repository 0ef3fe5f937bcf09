package tech.flowcatalyst.resourcebridge.engine.operations.findresources;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Registered resources visible to the caller.
 */
public record ResourceCatalog(int count, List<Entry> models) {

    public record Entry(
        @JsonProperty("model_name") String modelName,
        @JsonProperty("verbose_name") String verboseName,
        @JsonProperty("verbose_name_plural") String verboseNamePlural,
        @JsonProperty("app_label") String appLabel,
        @JsonProperty("tools_exposed") boolean toolsExposed
    ) {}
}
