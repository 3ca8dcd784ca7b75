package com.shardstore.migration.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shardstore.migration.schema.FieldType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Value conversions that can be attached to a type change.
 * Conversions throw {@link IllegalArgumentException} when a value cannot be converted.
 */
public enum BuiltInTransformation {

    STRING_TO_NUMBER {
        @Override
        public Object apply(Object value) {
            if (value instanceof Number) {
                return value;
            }
            try {
                BigDecimal number = new BigDecimal(String.valueOf(value).trim());
                if (number.scale() <= 0) {
                    try {
                        return number.longValueExact();
                    } catch (ArithmeticException e) {
                        return number;
                    }
                }
                return number.doubleValue();
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: " + value, e);
            }
        }
    },
    NUMBER_TO_STRING {
        @Override
        public Object apply(Object value) {
            return String.valueOf(value);
        }
    },
    STRING_TO_BOOLEAN {
        @Override
        public Object apply(Object value) {
            if (value instanceof Boolean) {
                return value;
            }
            String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            return "true".equals(text) || "1".equals(text) || "yes".equals(text);
        }
    },
    BOOLEAN_TO_STRING {
        @Override
        public Object apply(Object value) {
            return String.valueOf(value);
        }
    },
    VALUE_TO_ARRAY {
        @Override
        public Object apply(Object value) {
            if (value instanceof Collection) {
                return new ArrayList<>((Collection<?>) value);
            }
            return List.of(value);
        }
    },
    ARRAY_TO_VALUE {
        @Override
        public Object apply(Object value) {
            if (value instanceof List) {
                List<?> list = (List<?>) value;
                return list.isEmpty() ? null : list.get(0);
            }
            return value;
        }
    },
    DATE_TO_ISO {
        @Override
        public Object apply(Object value) {
            if (value instanceof Number) {
                return Instant.ofEpochMilli(((Number) value).longValue()).toString();
            }
            String text = String.valueOf(value).trim();
            try {
                return OffsetDateTime.parse(text).toInstant().toString();
            } catch (DateTimeParseException notOffset) {
                try {
                    return Instant.parse(text).toString();
                } catch (DateTimeParseException notInstant) {
                    try {
                        return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC).toString();
                    } catch (DateTimeParseException e) {
                        throw new IllegalArgumentException("Not a date: " + value, e);
                    }
                }
            }
        }
    },
    PARSE_JSON {
        @Override
        public Object apply(Object value) {
            if (!(value instanceof String)) {
                return value;
            }
            try {
                return MAPPER.readValue((String) value, Object.class);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
    },
    STRINGIFY_JSON {
        @Override
        public Object apply(Object value) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Value cannot be serialized: " + e.getOriginalMessage(), e);
            }
        }
    },
    TO_UPPERCASE {
        @Override
        public Object apply(Object value) {
            return value instanceof String ? ((String) value).toUpperCase(Locale.ROOT) : value;
        }
    },
    TO_LOWERCASE {
        @Override
        public Object apply(Object value) {
            return value instanceof String ? ((String) value).toLowerCase(Locale.ROOT) : value;
        }
    },
    TRIM {
        @Override
        public Object apply(Object value) {
            return value instanceof String ? ((String) value).trim() : value;
        }
    };

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<FieldType, Map<FieldType, BuiltInTransformation>> SUGGESTIONS =
            new EnumMap<>(FieldType.class);

    static {
        suggestion(FieldType.STRING, FieldType.INTEGER, STRING_TO_NUMBER);
        suggestion(FieldType.STRING, FieldType.FLOAT, STRING_TO_NUMBER);
        suggestion(FieldType.STRING, FieldType.NUMBER, STRING_TO_NUMBER);
        suggestion(FieldType.STRING, FieldType.BOOLEAN, STRING_TO_BOOLEAN);
        suggestion(FieldType.STRING, FieldType.DATE, DATE_TO_ISO);
        suggestion(FieldType.STRING, FieldType.JSON, PARSE_JSON);
        suggestion(FieldType.TEXT, FieldType.INTEGER, STRING_TO_NUMBER);
        suggestion(FieldType.TEXT, FieldType.FLOAT, STRING_TO_NUMBER);
        suggestion(FieldType.TEXT, FieldType.NUMBER, STRING_TO_NUMBER);
        suggestion(FieldType.TEXT, FieldType.BOOLEAN, STRING_TO_BOOLEAN);
        suggestion(FieldType.INTEGER, FieldType.STRING, NUMBER_TO_STRING);
        suggestion(FieldType.INTEGER, FieldType.TEXT, NUMBER_TO_STRING);
        suggestion(FieldType.FLOAT, FieldType.STRING, NUMBER_TO_STRING);
        suggestion(FieldType.FLOAT, FieldType.TEXT, NUMBER_TO_STRING);
        suggestion(FieldType.NUMBER, FieldType.STRING, NUMBER_TO_STRING);
        suggestion(FieldType.BOOLEAN, FieldType.STRING, BOOLEAN_TO_STRING);
        suggestion(FieldType.BOOLEAN, FieldType.TEXT, BOOLEAN_TO_STRING);
        suggestion(FieldType.SELECT, FieldType.MULTISELECT, VALUE_TO_ARRAY);
        suggestion(FieldType.MULTISELECT, FieldType.SELECT, ARRAY_TO_VALUE);
        suggestion(FieldType.JSON, FieldType.STRING, STRINGIFY_JSON);
        suggestion(FieldType.JSON, FieldType.TEXT, STRINGIFY_JSON);
    }

    private static void suggestion(FieldType from, FieldType to, BuiltInTransformation transformation) {
        SUGGESTIONS.computeIfAbsent(from, key -> new EnumMap<>(FieldType.class)).put(to, transformation);
    }

    /**
     * Converts a single non-null field value.
     */
    public abstract Object apply(Object value);

    /**
     * Conversion usually appropriate for a change from {@code from} to {@code to}, if any.
     */
    public static Optional<BuiltInTransformation> suggest(FieldType from, FieldType to) {
        return Optional.ofNullable(SUGGESTIONS.getOrDefault(from, Map.of()).get(to));
    }
}
