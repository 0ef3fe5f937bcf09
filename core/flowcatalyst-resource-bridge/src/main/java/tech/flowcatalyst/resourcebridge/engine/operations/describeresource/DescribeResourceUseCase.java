package tech.flowcatalyst.resourcebridge.engine.operations.describeresource;

import jakarta.enterprise.context.ApplicationScoped;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.resource.ChildDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldChoice;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Use case for describing a resource's fields, relationships and admin settings.
 */
@ApplicationScoped
public class DescribeResourceUseCase {

    static final String FOREIGN_KEY = "foreign_key";

    public Result<ResourceDescription> execute(RegisteredResource resource, ExecutionContext context) {
        ResourceDescriptor descriptor = resource.descriptor();

        List<ResourceDescription.FieldInfo> fields = new ArrayList<>();
        List<ResourceDescription.RelationshipInfo> relationships = new ArrayList<>();
        for (FieldDescriptor field : descriptor.exposedFields()) {
            fields.add(describe(field));
            if (field.relatedResource() != null) {
                relationships.add(new ResourceDescription.RelationshipInfo(field.name(), FOREIGN_KEY, field.relatedResource()));
            }
        }

        List<ResourceDescription.InlineInfo> inlines = new ArrayList<>();
        for (ChildDescriptor child : descriptor.childDescriptors()) {
            inlines.add(new ResourceDescription.InlineInfo(child.resource(), child.fkField()));
        }

        ResourceDescription.AdminConfig adminConfig = new ResourceDescription.AdminConfig(
            descriptor.listDisplay(),
            descriptor.listFilter(),
            descriptor.exposedSearchFields(),
            descriptor.defaultOrdering(),
            descriptor.readonlyFields().stream()
                .filter(name -> !descriptor.excludedFields().contains(name))
                .sorted()
                .toList(),
            inlines
        );

        return Result.success(new ResourceDescription(
            descriptor.name(),
            descriptor.verboseName(),
            descriptor.verboseNamePlural(),
            descriptor.appLabel(),
            fields,
            relationships,
            adminConfig
        ));
    }

    private static ResourceDescription.FieldInfo describe(FieldDescriptor field) {
        List<ResourceDescription.Choice> choices = null;
        if (!field.choices().isEmpty()) {
            choices = new ArrayList<>();
            for (FieldChoice choice : field.choices()) {
                choices.add(new ResourceDescription.Choice(choice.value(), choice.label()));
            }
        }
        return new ResourceDescription.FieldInfo(
            field.name(),
            field.type().code(),
            field.verboseName(),
            field.required(),
            field.maxLength(),
            field.helpText(),
            choices,
            field.defaultValue(),
            field.primaryKey() ? Boolean.TRUE : null,
            field.unique() ? Boolean.TRUE : null,
            field.editable()
        );
    }
}
