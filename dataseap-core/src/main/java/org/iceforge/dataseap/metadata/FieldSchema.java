package org.iceforge.dataseap.metadata;

/**
 * One column as reported by {@code DESC}.
 */
public record FieldSchema(String name, String type, boolean nullable, boolean key, String defaultValue, String extra) {
}
