package tech.flowcatalyst.resourcebridge.resource;

/**
 * One allowed value of a field with a fixed set of choices.
 */
public record FieldChoice(Object value, String label) {

    public static FieldChoice of(Object value, String label) {
        return new FieldChoice(value, label);
    }
}
