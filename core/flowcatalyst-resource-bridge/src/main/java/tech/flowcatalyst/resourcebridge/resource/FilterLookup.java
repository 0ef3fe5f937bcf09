package tech.flowcatalyst.resourcebridge.resource;

import java.util.Optional;

/**
 * Comparison applied by a {@link FieldFilter}. Keys use "field__lookup" form;
 * a bare field name means {@link #EXACT}.
 */
public enum FilterLookup {
    EXACT("exact"),
    IEXACT("iexact"),
    CONTAINS("contains"),
    ICONTAINS("icontains"),
    ISTARTSWITH("istartswith"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("in"),
    ISNULL("isnull");

    private final String code;

    FilterLookup(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<FilterLookup> fromCode(String code) {
        for (FilterLookup lookup : values()) {
            if (lookup.code.equals(code)) {
                return Optional.of(lookup);
            }
        }
        return Optional.empty();
    }
}
