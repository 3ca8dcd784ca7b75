package com.shardstore.migration.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.shardstore.migration.config.MigrationProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CompatibilityClassifier")
class CompatibilityClassifierTest {

    private MigrationProperties properties;
    private SchemaDiffer differ;
    private CompatibilityClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new MigrationProperties();
        differ = new SchemaDiffer(properties);
        classifier = new CompatibilityClassifier(properties);
    }

    private CompatibilityResult classify(SchemaDefinition before, SchemaDefinition after) {
        return classifier.classify(differ.diff(before, after));
    }

    @Nested
    @DisplayName("compatible changes")
    class Compatible {

        @Test
        @DisplayName("adding an optional field is compatible")
        void optionalAddition() {
            CompatibilityResult result = classify(
                    SchemaDefinition.builder().field("title", FieldType.STRING, true).build(),
                    SchemaDefinition.builder()
                            .field("title", FieldType.STRING, true)
                            .field("notes", FieldType.TEXT, false)
                            .build());

            assertThat(result.isCompatible()).isTrue();
            assertThat(result.getBreakingReasons()).isEmpty();
            assertThat(result.getRecommendations()).isEmpty();
        }

        @Test
        @DisplayName("adding a required field with a schema default is compatible")
        void requiredWithDefault() {
            CompatibilityResult result = classify(
                    SchemaDefinition.empty(),
                    SchemaDefinition.builder()
                            .field("priority", FieldDefinition.builder()
                                    .type(FieldType.INTEGER).required(true).defaultValue(0).build())
                            .build());

            assertThat(result.isCompatible()).isTrue();
        }

        @Test
        @DisplayName("relaxing a required field is compatible")
        void madeOptional() {
            CompatibilityResult result = classify(
                    SchemaDefinition.builder().field("title", FieldType.STRING, true).build(),
                    SchemaDefinition.builder().field("title", FieldType.STRING, false).build());

            assertThat(result.isCompatible()).isTrue();
        }

        @Test
        @DisplayName("adding allowed values is compatible")
        void enumSuperset() {
            CompatibilityResult result = classify(
                    SchemaDefinition.builder().field("state", FieldDefinition.builder()
                            .type(FieldType.ENUM).allowedValues(List.of("open", "closed")).build()).build(),
                    SchemaDefinition.builder().field("state", FieldDefinition.builder()
                            .type(FieldType.ENUM).allowedValues(List.of("open", "closed", "archived")).build()).build());

            assertThat(result.isCompatible()).isTrue();
        }
    }

    @Nested
    @DisplayName("breaking changes")
    class Breaking {

        @Test
        @DisplayName("required field without default")
        void requiredWithoutDefault() {
            CompatibilityResult result = classify(
                    SchemaDefinition.empty(),
                    SchemaDefinition.builder().field("priority", FieldType.INTEGER, true).build());

            assertThat(result.isCompatible()).isFalse();
            assertThat(result.getBreakingReasons())
                    .containsExactly("Field 'priority' added as required without a default value");
            assertThat(result.getBreakingChanges().get(0).getKind())
                    .isEqualTo(BreakingChangeKind.REQUIRED_FIELD_ADDED);
        }

        @Test
        @DisplayName("type change carries a suggested transformation")
        void typeChange() {
            CompatibilityResult result = classify(
                    SchemaDefinition.builder().field("count", FieldType.STRING, false).build(),
                    SchemaDefinition.builder().field("count", FieldType.INTEGER, false).build());

            assertThat(result.getBreakingReasons())
                    .containsExactly("Field 'count' type changed from 'string' to 'integer'");
            assertThat(result.getBreakingChanges().get(0).getResolution())
                    .isEqualTo("Use transformation: STRING_TO_NUMBER");
        }

        @Test
        @DisplayName("collects every reason rather than stopping at the first")
        void collectsAllReasons() {
            CompatibilityResult result = classify(
                    SchemaDefinition.builder()
                            .field("legacy", FieldType.BOOLEAN, false)
                            .field("count", FieldType.STRING, false)
                            .field("owner", FieldType.STRING, false)
                            .build(),
                    SchemaDefinition.builder()
                            .field("count", FieldType.INTEGER, false)
                            .field("owner", FieldType.STRING, true)
                            .field("priority", FieldType.INTEGER, true)
                            .build());

            assertThat(result.getBreakingChanges())
                    .extracting(BreakingChange::getKind)
                    .containsExactlyInAnyOrder(
                            BreakingChangeKind.REQUIRED_FIELD_ADDED,
                            BreakingChangeKind.FIELD_REMOVED,
                            BreakingChangeKind.TYPE_CHANGED,
                            BreakingChangeKind.MADE_REQUIRED);
            assertThat(result.getRecommendations())
                    .contains("Back up existing data before migration",
                            "Removed fields will lose data - export first if needed");
        }

        @Test
        @DisplayName("removing an allowed value is breaking")
        void narrowing() {
            CompatibilityResult result = classify(
                    SchemaDefinition.builder().field("state", FieldDefinition.builder()
                            .type(FieldType.ENUM).allowedValues(List.of("open", "closed")).build()).build(),
                    SchemaDefinition.builder().field("state", FieldDefinition.builder()
                            .type(FieldType.ENUM).allowedValues(List.of("open")).build()).build());

            assertThat(result.getBreakingReasons()).containsExactly("Field 'state' no longer allows [closed]");
        }

        @Test
        @DisplayName("a possible rename is reported next to the removal")
        void possibleRename() {
            CompatibilityResult result = classify(
                    SchemaDefinition.builder().field("firstName", FieldType.STRING, false).build(),
                    SchemaDefinition.builder().field("first_name", FieldType.STRING, false).build());

            assertThat(result.getBreakingChanges())
                    .extracting(BreakingChange::getKind)
                    .containsExactly(BreakingChangeKind.FIELD_REMOVED, BreakingChangeKind.POSSIBLE_RENAME);
            assertThat(result.getBreakingChanges().get(1).getRelatedField()).isEqualTo("first_name");
        }
    }

    @Nested
    @DisplayName("widening")
    class Widening {

        private final SchemaDefinition integerSchema =
                SchemaDefinition.builder().field("amount", FieldType.INTEGER, false).build();
        private final SchemaDefinition floatSchema =
                SchemaDefinition.builder().field("amount", FieldType.FLOAT, false).build();

        @Test
        @DisplayName("is breaking by default")
        void breakingByDefault() {
            assertThat(classify(integerSchema, floatSchema).isCompatible()).isFalse();
        }

        @Test
        @DisplayName("is compatible when enabled")
        void compatibleWhenEnabled() {
            properties.getCompatibility().setAllowWidening(true);

            assertThat(classify(integerSchema, floatSchema).isCompatible()).isTrue();
            assertThat(classify(floatSchema, integerSchema).isCompatible()).isFalse();
        }
    }
}
