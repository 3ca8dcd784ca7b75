package com.shardstore.migration.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declaration of a single field within a {@link SchemaDefinition}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDefinition {

    FieldType type;

    boolean required;

    /**
     * Value filled into records that do not carry the field. Optional.
     */
    Object defaultValue;

    /**
     * Closed list of accepted values for enum/select fields. Optional.
     */
    List<String> allowedValues;

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    /**
     * Whether both fields carry the same default. Numbers compare by value, so a
     * {@code 0L} default equals an {@code Integer} 0 read back from JSON.
     */
    public boolean hasSameDefault(FieldDefinition other) {
        return sameValue(defaultValue, other.getDefaultValue());
    }

    static boolean sameValue(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            BigDecimal a = toDecimal((Number) left);
            BigDecimal b = toDecimal((Number) right);
            return a != null && b != null ? a.compareTo(b) == 0 : left.equals(right);
        }
        if (left instanceof List && right instanceof List) {
            List<?> a = (List<?>) left;
            List<?> b = (List<?>) right;
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!sameValue(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Map && right instanceof Map) {
            Map<?, ?> a = (Map<?, ?>) left;
            Map<?, ?> b = (Map<?, ?>) right;
            return a.keySet().equals(b.keySet())
                    && a.entrySet().stream().allMatch(entry -> sameValue(entry.getValue(), b.get(entry.getKey())));
        }
        return Objects.equals(left, right);
    }

    // Null for NaN and infinities, which have no decimal form
    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? BigDecimal.valueOf(value) : null;
        }
        return BigDecimal.valueOf(number.longValue());
    }

    public static FieldDefinition optional(FieldType type) {
        return FieldDefinition.builder().type(type).required(false).build();
    }

    public static FieldDefinition required(FieldType type) {
        return FieldDefinition.builder().type(type).required(true).build();
    }
}
