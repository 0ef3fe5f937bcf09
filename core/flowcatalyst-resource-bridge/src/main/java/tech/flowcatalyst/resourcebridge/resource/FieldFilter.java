package tech.flowcatalyst.resourcebridge.resource;

/**
 * One conjunctive filter criterion.
 *
 * @param field  field name
 * @param lookup comparison
 * @param value  coerced comparison value; a list for IN, a Boolean for ISNULL
 */
public record FieldFilter(String field, FilterLookup lookup, Object value) {
}
