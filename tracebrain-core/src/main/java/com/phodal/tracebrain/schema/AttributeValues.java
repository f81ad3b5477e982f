package com.phodal.tracebrain.schema;

import com.phodal.tracebrain.error.ValidationException;

import java.util.Map;

/**
 * Strict readers for values of the open attribute bag.
 * A missing key reads as {@code null}; a present key of the wrong type is a validation error.
 */
final class AttributeValues {

    private AttributeValues() {
    }

    static String string(Map<String, Object> attributes, String key, String spanId) {
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        throw new ValidationException("Attribute '" + key + "' must be a string", spanId);
    }

    static Long wholeNumber(Object value, String field, String spanId) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.longValue();
        }
        throw new ValidationException("'" + field + "' must be a whole number", spanId);
    }

    static Double decimal(Object value, String field, String spanId) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ValidationException("'" + field + "' must be a number", spanId);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> object(Object value, String field, String spanId) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ValidationException("'" + field + "' must be an object", spanId);
    }
}
