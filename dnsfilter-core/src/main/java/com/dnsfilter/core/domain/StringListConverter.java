package com.dnsfilter.core.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stores an ordered list of tokens (record types, operations, CIDR ranges)
 * as a comma-separated column. Order is preserved; an empty list is stored as NULL.
 */
@Converter
public class StringListConverter implements AttributeConverter<List<String>, String> {

    private static final String SEPARATOR = ",";

    @Override
    public String convertToDatabaseColumn(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        for (String value : values) {
            if (value == null || value.contains(SEPARATOR)) {
                throw new IllegalArgumentException("List element cannot be null or contain '" + SEPARATOR + "': " + value);
            }
        }
        return String.join(SEPARATOR, values);
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.stream(column.split(SEPARATOR))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
    }
}
