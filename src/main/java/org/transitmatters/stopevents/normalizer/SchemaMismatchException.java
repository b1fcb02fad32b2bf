package org.transitmatters.stopevents.normalizer;

import java.util.List;

/**
 * A source lacks columns that its schema variant requires. Fatal for that source.
 */
public class SchemaMismatchException extends Exception {
    private final SchemaVariant variant;
    private final List<String> missingColumns;

    public SchemaMismatchException(String sourceName, SchemaVariant variant, List<String> missingColumns) {
        super("Source " + sourceName + " does not match schema " + variant + ", missing columns " + missingColumns);
        this.variant = variant;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public SchemaVariant getVariant() {
        return variant;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
