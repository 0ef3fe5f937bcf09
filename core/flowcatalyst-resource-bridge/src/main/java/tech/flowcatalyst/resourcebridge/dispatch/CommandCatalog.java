package tech.flowcatalyst.resourcebridge.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkOperation;
import tech.flowcatalyst.resourcebridge.resource.ChildDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldChoice;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Publishes the commands the dispatcher accepts, with input schemas derived
 * from each resource's field metadata.
 */
@ApplicationScoped
public class CommandCatalog {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    ResourceRegistry registry;

    /**
     * find_models first, then every operation of every registered resource,
     * resources in name order.
     */
    public List<CommandDescriptor> listCommands() {
        List<CommandDescriptor> commands = new ArrayList<>();
        commands.add(findModels());

        List<RegisteredResource> resources = new ArrayList<>(registry.all());
        resources.sort(Comparator.comparing(RegisteredResource::name));
        for (RegisteredResource resource : resources) {
            for (OperationType operation : OperationType.values()) {
                commands.add(describe(operation, resource.descriptor()));
            }
        }
        return commands;
    }

    CommandDescriptor describe(OperationType operation, ResourceDescriptor descriptor) {
        String name = new CommandName(operation, descriptor.name()).format();
        String subject = operation == OperationType.GET
            || operation == OperationType.CREATE
            || operation == OperationType.UPDATE
            || operation == OperationType.DELETE
            || operation == OperationType.RELATED
            || operation == OperationType.HISTORY
            ? descriptor.verboseName()
            : descriptor.verboseNamePlural();
        return new CommandDescriptor(name, operation.describe(subject), schema(operation, descriptor));
    }

    private CommandDescriptor findModels() {
        ObjectNode schema = objectSchema();
        property(schema, "query", "string", "Case-insensitive text matched against resource names");
        return new CommandDescriptor(
            CommandDispatcher.FIND_MODELS,
            "Find the registered resources you may view",
            schema
        );
    }

    private ObjectNode schema(OperationType operation, ResourceDescriptor descriptor) {
        ObjectNode schema = objectSchema();
        String idType = descriptor.primaryKey().jsonType();
        switch (operation) {
            case LIST -> {
                ObjectNode filters = property(schema, "filters", "object",
                    "Filters keyed by field or field__lookup (exact, iexact, contains, icontains, istartswith, gt, gte, lt, lte, in, isnull)");
                filters.put("additionalProperties", true);
                property(schema, "search", "string", "Text searched across " + String.join(", ", descriptor.exposedSearchFields()));
                arrayProperty(schema, "order_by", "string", "Fields to order by, prefix with - for descending");
                property(schema, "limit", "integer", "Maximum number of results");
                property(schema, "offset", "integer", "Number of results to skip");
            }
            case GET -> {
                property(schema, "id", idType, "Primary key");
                property(schema, "include_inlines", "boolean", "Include inline child records");
                property(schema, "include_related", "boolean", "Include related record previews");
                required(schema, "id");
            }
            case CREATE -> {
                ObjectNode data = dataSchema(descriptor, true);
                data.put("description", "Field values for the new record");
                properties(schema).set("data", data);
                required(schema, "data");
            }
            case UPDATE -> {
                property(schema, "id", idType, "Primary key");
                ObjectNode data = dataSchema(descriptor, false);
                data.put("description", "Fields to change");
                properties(schema).set("data", data);
                ObjectNode inlines = property(schema, "inlines", "object",
                    "Inline items keyed by child resource: {id?, data, _delete?}");
                ObjectNode children = inlines.putObject("properties");
                for (ChildDescriptor child : descriptor.childDescriptors()) {
                    ObjectNode items = children.putObject(child.resource());
                    items.put("type", "array");
                    items.putObject("items").put("type", "object");
                }
                required(schema, "id");
            }
            case DELETE, HISTORY -> {
                property(schema, "id", idType, "Primary key");
                if (operation == OperationType.HISTORY) {
                    property(schema, "limit", "integer", "Maximum number of entries");
                }
                required(schema, "id");
            }
            case ACTION -> {
                property(schema, "action", "string", "Action name, delete_selected or a custom action");
                arrayProperty(schema, "ids", idType, "Primary keys of the selected records");
                required(schema, "action", "ids");
            }
            case BULK -> {
                ObjectNode op = property(schema, "operation", "string", "Operation applied to every item");
                ArrayNode values = op.putArray("enum");
                for (BulkOperation bulk : BulkOperation.values()) {
                    values.add(bulk.code());
                }
                ObjectNode items = property(schema, "items", "array",
                    "Field objects for create, {id, data} objects for update, ids for delete");
                items.putObject("items");
                required(schema, "operation", "items");
            }
            case RELATED -> {
                property(schema, "id", idType, "Primary key");
                ObjectNode relation = property(schema, "relation", "string", "Relation name");
                ArrayNode names = relation.putArray("enum");
                descriptor.relations().forEach(r -> names.add(r.name()));
                property(schema, "limit", "integer", "Maximum number of results");
                property(schema, "offset", "integer", "Number of results to skip");
                required(schema, "id", "relation");
            }
            case AUTOCOMPLETE -> {
                property(schema, "term", "string", "Search term");
                property(schema, "limit", "integer", "Maximum number of suggestions");
            }
        }
        return schema;
    }

    private static ObjectNode dataSchema(ResourceDescriptor descriptor, boolean forCreate) {
        ObjectNode data = objectSchema();
        List<String> required = new ArrayList<>();
        for (FieldDescriptor field : descriptor.exposedFields()) {
            if (!field.editable() || descriptor.readonlyFields().contains(field.name())) {
                continue;
            }
            ObjectNode property = property(data, field.name(), field.jsonType(),
                field.helpText() != null ? field.helpText() : field.verboseName());
            if (field.maxLength() != null) {
                property.put("maxLength", field.maxLength());
            }
            if (!field.choices().isEmpty()) {
                ArrayNode values = property.putArray("enum");
                for (FieldChoice choice : field.choices()) {
                    values.addPOJO(choice.value());
                }
            }
            if (forCreate && field.required()) {
                required.add(field.name());
            }
        }
        if (!required.isEmpty()) {
            required(data, required.toArray(new String[0]));
        }
        return data;
    }

    private static ObjectNode objectSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    private static ObjectNode properties(ObjectNode schema) {
        return (ObjectNode) schema.get("properties");
    }

    private static ObjectNode property(ObjectNode schema, String name, String type, String description) {
        ObjectNode property = properties(schema).putObject(name);
        property.put("type", type);
        if (description != null && !description.isBlank()) {
            property.put("description", description);
        }
        return property;
    }

    private static void arrayProperty(ObjectNode schema, String name, String itemType, String description) {
        ObjectNode property = property(schema, name, "array", description);
        property.putObject("items").put("type", itemType);
    }

    private static void required(ObjectNode schema, String... names) {
        ArrayNode required = schema.putArray("required");
        for (String name : names) {
            required.add(name);
        }
    }
}
