package com.shardstore.migration.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.schema.FieldDefinition;
import com.shardstore.migration.schema.FieldType;
import com.shardstore.migration.schema.SchemaDefinition;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SchemaValidator")
class SchemaValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {"title", "first_name", "_internal", "x-ref", "field2"})
    @DisplayName("accepts well-formed field names")
    void validNames(String name) {
        assertThat(SchemaValidator.isValidFieldName(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2fast", "-dash", "has space", "semi;colon"})
    @DisplayName("rejects malformed field names")
    void invalidNames(String name) {
        assertThat(SchemaValidator.isValidFieldName(name)).isFalse();
    }

    @Test
    @DisplayName("rejects names over the length limit")
    void tooLong() {
        assertThat(SchemaValidator.isValidFieldName("a".repeat(129))).isFalse();
        assertThat(SchemaValidator.isValidFieldName(null)).isFalse();
    }

    @Test
    @DisplayName("accepts a well-formed schema")
    void validSchema() {
        SchemaDefinition schema = SchemaDefinition.builder()
                .field("title", FieldType.STRING, true)
                .field("state", FieldDefinition.builder()
                        .type(FieldType.ENUM).allowedValues(List.of("open", "closed")).defaultValue("open").build())
                .build();

        assertThatCode(() -> SchemaValidator.validateSchema(schema)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("reports every problem of a malformed schema")
    void reportsAllProblems() {
        SchemaDefinition schema = SchemaDefinition.builder()
                .field("bad name", FieldType.STRING, false)
                .field("untyped", FieldDefinition.builder().build())
                .field("count", FieldDefinition.builder().type(FieldType.INTEGER).allowedValues(List.of("1")).build())
                .build();

        assertThatThrownBy(() -> SchemaValidator.validateSchema(schema))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getReasons()).containsExactly(
                        "Invalid field name: 'bad name'",
                        "Field 'untyped' has no type",
                        "Field 'count' of type 'integer' cannot declare allowed values"));
    }

    @Test
    @DisplayName("rejects a default outside the allowed values")
    void defaultOutsideAllowedValues() {
        SchemaDefinition schema = SchemaDefinition.builder()
                .field("state", FieldDefinition.builder()
                        .type(FieldType.SELECT).allowedValues(List.of("open")).defaultValue("closed").build())
                .build();

        assertThat(SchemaValidator.findProblems(schema))
                .containsExactly("Default value of field 'state' is not an allowed value");
    }
}
