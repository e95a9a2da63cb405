package com.promptflow.promptflow_backend.variable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.promptflow.promptflow_backend.model.node.VariableDataType;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Field checks and type conversion for the execution dialog.
 * Values arrive either as text typed by the user or as JSON scalars from the REST layer.
 */
@RequiredArgsConstructor
public class VariableCoercer {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final ObjectMapper objectMapper;

    // Exactly one JSON value: trailing content is an error
    private ObjectReader strictReader() {
        return objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /** Starting value of a field: the declared default, else the empty value of its type. */
    public Object initialValue(FlowVariable variable) {
        if (variable.hasDefaultValue()) {
            return variable.defaultValue();
        }
        return emptyValue(variable.type());
    }

    public static boolean isEmpty(Object value) {
        return value == null || (value instanceof String s && s.isEmpty());
    }

    public Optional<String> validate(FlowVariable variable, Object value) {
        if (isEmpty(value)) {
            return variable.required()
                    ? Optional.of(variable.name() + " is required")
                    : Optional.empty();
        }
        VariableDataType type = variable.type() != null ? variable.type() : VariableDataType.STRING;
        return switch (type) {
            case NUMBER -> isNumeric(value) ? Optional.empty() : Optional.of(variable.name() + " must be a valid number");
            case JSON -> isJson(value) ? Optional.empty() : Optional.of(variable.name() + " must be valid JSON");
            default -> Optional.empty();
        };
    }

    /** Converts a value that already passed {@link #validate}. */
    public Object coerce(FlowVariable variable, Object value) {
        VariableDataType type = variable.type() != null ? variable.type() : VariableDataType.STRING;
        return switch (type) {
            case STRING -> value;
            case NUMBER -> toNumber(value);
            case BOOLEAN -> toBoolean(value);
            case JSON -> toJson(value);
        };
    }

    private Object emptyValue(VariableDataType type) {
        if (type == null) return "";
        return switch (type) {
            case STRING -> "";
            case NUMBER -> 0L;
            case BOOLEAN -> false;
            case JSON -> new LinkedHashMap<String, Object>();
        };
    }

    private boolean isNumeric(Object value) {
        if (value instanceof Number || value instanceof Boolean) return true;
        if (value instanceof String s) {
            String trimmed = s.trim();
            return trimmed.isEmpty() || DECIMAL.matcher(trimmed).matches();
        }
        return false;
    }

    private boolean isJson(Object value) {
        if (!(value instanceof String s)) return true;
        if (s.isBlank()) return false;
        try {
            JsonNode node = strictReader().readTree(s);
            return node != null && !node.isMissingNode();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private Object toNumber(Object value) {
        if (value == null) return 0L;
        if (value instanceof Boolean b) return b ? 1L : 0L;
        if (value instanceof Number n) {
            return n instanceof Double || n instanceof Float ? wholeNumber(n.doubleValue()) : n;
        }
        String trimmed = value.toString().trim();
        if (trimmed.isEmpty()) return 0L;
        return wholeNumber(Double.parseDouble(trimmed));
    }

    private static Object wholeNumber(double d) {
        if (d == Math.floor(d) && !Double.isInfinite(d) && Math.abs(d) < Long.MAX_VALUE) {
            return (long) d;
        }
        return d;
    }

    private boolean toBoolean(Object value) {
        if (value == null)            return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number)  return ((Number) value).doubleValue() != 0;
        if (value instanceof String)  return !((String) value).isBlank() && !"false".equalsIgnoreCase((String) value);
        return true;
    }

    private Object toJson(Object value) {
        if (!(value instanceof String s)) return value;
        if (s.isEmpty()) return new LinkedHashMap<String, Object>();
        try {
            return strictReader().forType(Object.class).readValue(s);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value was not validated as JSON", e);
        }
    }
}
