package org.transitmatters.stopevents.normalizer;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Column positions of a {@link SchemaVariant} within one concrete source.
 */
public final class ColumnBinding {
    private final SchemaVariant variant;
    private final ImmutableMap<SourceField, Integer> indexes;

    ColumnBinding(SchemaVariant variant, Map<SourceField, Integer> indexes) {
        this.variant = variant;
        this.indexes = ImmutableMap.copyOf(indexes);
    }

    public SchemaVariant getVariant() {
        return variant;
    }

    public boolean isBound(SourceField field) {
        return indexes.containsKey(field);
    }

    /**
     * @return trimmed value, or null if the value is blank or the field is not present in this source
     */
    public String get(String[] row, SourceField field) {
        Integer index = indexes.get(field);
        if (index == null || index >= row.length || row[index] == null) {
            return null;
        }
        String value = row[index].trim();
        if (value.isEmpty() || "null".equalsIgnoreCase(value) || "nan".equalsIgnoreCase(value)) {
            return null;
        }
        return value;
    }
}
