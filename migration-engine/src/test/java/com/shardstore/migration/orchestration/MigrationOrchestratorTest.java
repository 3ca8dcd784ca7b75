package com.shardstore.migration.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.shardstore.migration.config.MigrationProperties;
import com.shardstore.migration.exception.ConflictException;
import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.model.MigrationStatus;
import com.shardstore.migration.model.MigrationStrategy;
import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.model.SchemaPreview;
import com.shardstore.migration.model.ShardType;
import com.shardstore.migration.schema.CompatibilityClassifier;
import com.shardstore.migration.schema.FieldDefinition;
import com.shardstore.migration.schema.FieldType;
import com.shardstore.migration.schema.SchemaDefinition;
import com.shardstore.migration.schema.SchemaDiffer;
import com.shardstore.migration.store.MigrationRecordStore;
import com.shardstore.migration.store.ShardTypeStore;
import com.shardstore.migration.transform.BuiltInTransformation;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("MigrationOrchestrator")
class MigrationOrchestratorTest {

    private static final String TENANT = "tenant-1";

    @Mock
    private MigrationRecordStore migrationStore;

    @Mock
    private ShardTypeStore shardTypeStore;

    private MigrationOrchestrator orchestrator;

    private final ShardType contacts = ShardType.builder()
            .id("contacts")
            .tenantId(TENANT)
            .name("Contacts")
            .schemaVersion(1)
            .schema(SchemaDefinition.builder()
                    .field("email", FieldType.STRING, true)
                    .field("age", FieldType.STRING, false)
                    .field("fax", FieldType.STRING, false)
                    .build())
            .build();

    @BeforeEach
    void setUp() {
        MigrationProperties properties = new MigrationProperties();
        orchestrator = new MigrationOrchestrator(
                new SchemaDiffer(properties),
                new CompatibilityClassifier(properties),
                migrationStore,
                shardTypeStore,
                new MigrationPathResolver(migrationStore));
    }

    private void acceptWrites() {
        when(shardTypeStore.bumpSchemaVersion(eq(TENANT), eq("contacts"), eq(1), any()))
                .thenAnswer(invocation -> ShardType.builder()
                        .id("contacts")
                        .tenantId(TENANT)
                        .schemaVersion(2)
                        .schema(invocation.getArgument(3))
                        .build());
        when(migrationStore.create(any())).thenAnswer(returnsFirstArg());
    }

    @Nested
    @DisplayName("breaking change resolution")
    class Resolution {

        private final SchemaDefinition dropFaxRetypeAge = SchemaDefinition.builder()
                .field("email", FieldType.STRING, true)
                .field("age", FieldType.INTEGER, false)
                .build();

        @Test
        @DisplayName("preview lists what the options leave unresolved")
        void previewUnresolved() {
            SchemaPreview preview = orchestrator.preview(contacts, dropFaxRetypeAge, MigrationOptions.builder()
                    .acknowledgedRemovals(Set.of("fax"))
                    .build());

            assertThat(preview.getUnresolvedReasons())
                    .containsExactly("Field 'age' type changed from 'string' to 'integer'");
            assertThat(preview.getCompatibility().getBreakingChanges()).hasSize(2);
        }

        @Test
        @DisplayName("acknowledged removals and type transformations allow creation")
        void resolvedCreates() {
            acceptWrites();

            SchemaMigration migration = orchestrator.createMigration(TENANT, contacts, dropFaxRetypeAge, "actor",
                    MigrationOptions.builder()
                            .acknowledgedRemovals(Set.of("fax"))
                            .typeTransformations(Map.of("age", BuiltInTransformation.STRING_TO_NUMBER))
                            .build());

            assertThat(migration.getId()).isNotBlank();
            assertThat(migration.getFromVersion()).isEqualTo(1);
            assertThat(migration.getToVersion()).isEqualTo(2);
            assertThat(migration.getStrategy()).isEqualTo(MigrationStrategy.EAGER);
            assertThat(migration.getStatus()).isEqualTo(MigrationStatus.PENDING);
            assertThat(migration.getTypeTransformations()).containsEntry("age", BuiltInTransformation.STRING_TO_NUMBER);
            assertThat(migration.getFromSchema()).isEqualTo(contacts.getSchema());
        }

        @Test
        @DisplayName("unresolved changes abort before anything is written")
        void unresolvedAborts() {
            assertThatThrownBy(() -> orchestrator.createMigration(
                    TENANT, contacts, dropFaxRetypeAge, "actor", MigrationOptions.none()))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getReasons()).containsExactly(
                            "Field 'fax' removed",
                            "Field 'age' type changed from 'string' to 'integer'"));
            verify(shardTypeStore, never()).bumpSchemaVersion(anyString(), anyString(), anyInt(), any());
        }

        @Test
        @DisplayName("an explicit strategy overrides the recommendation")
        void explicitStrategy() {
            acceptWrites();
            SchemaDefinition withNotes = SchemaDefinition.builder()
                    .field("email", FieldType.STRING, true)
                    .field("age", FieldType.STRING, false)
                    .field("fax", FieldType.STRING, false)
                    .field("notes", FieldDefinition.optional(FieldType.TEXT))
                    .build();

            SchemaMigration migration = orchestrator.createMigration(TENANT, contacts, withNotes, "actor",
                    MigrationOptions.builder().strategy(MigrationStrategy.EAGER).build());

            assertThat(migration.getStrategy()).isEqualTo(MigrationStrategy.EAGER);
        }
    }

    @Nested
    @DisplayName("option validation")
    class OptionValidation {

        @Test
        @DisplayName("rejects mappings that do not pair a removed field with an added one")
        void badMapping() {
            SchemaDefinition renamed = SchemaDefinition.builder()
                    .field("email", FieldType.STRING, true)
                    .field("age", FieldType.STRING, false)
                    .field("phone", FieldType.STRING, false)
                    .build();

            assertThatThrownBy(() -> orchestrator.createMigration(TENANT, contacts, renamed, "actor",
                    MigrationOptions.builder().fieldMappings(Map.of("email", "phone")).build()))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getReasons())
                            .containsExactly("Field mapping source 'email' is not a field removed by this change"));
        }

        @Test
        @DisplayName("rejects defaults for unknown fields and needless transformations")
        void badDefaultsAndTransformations() {
            SchemaDefinition withNotes = SchemaDefinition.builder()
                    .field("email", FieldType.STRING, true)
                    .field("age", FieldType.STRING, false)
                    .field("fax", FieldType.STRING, false)
                    .field("notes", FieldType.TEXT, false)
                    .build();

            assertThatThrownBy(() -> orchestrator.createMigration(TENANT, contacts, withNotes, "actor",
                    MigrationOptions.builder()
                            .defaultValues(Map.of("nickname", "x"))
                            .typeTransformations(Map.of("email", BuiltInTransformation.TRIM))
                            .acknowledgedRemovals(Set.of("age"))
                            .build()))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getReasons()).containsExactly(
                            "Default value given for unknown field 'nickname'",
                            "Type transformation given for field 'email' whose type does not change",
                            "Acknowledged removal 'age' is neither removed nor narrowed by this change"));
        }

        @Test
        @DisplayName("rejects malformed schemas")
        void malformedSchema() {
            SchemaDefinition malformed = SchemaDefinition.builder().field("bad name", FieldType.STRING, false).build();

            assertThatThrownBy(() -> orchestrator.createMigration(
                    TENANT, contacts, malformed, "actor", MigrationOptions.none()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Invalid field name");
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancels a running migration and frees the type")
        void cancelsRunning() {
            SchemaMigration running = SchemaMigration.builder()
                    .id("m-1").tenantId(TENANT).shardTypeId("contacts").status(MigrationStatus.RUNNING).build();
            SchemaMigration cancelled = SchemaMigration.builder()
                    .id("m-1").tenantId(TENANT).shardTypeId("contacts").status(MigrationStatus.CANCELLED).build();
            when(migrationStore.getById("m-1", TENANT)).thenReturn(running);
            when(migrationStore.updateStatus("m-1", TENANT, MigrationStatus.RUNNING, MigrationStatus.CANCELLED, null))
                    .thenReturn(cancelled);

            assertThat(orchestrator.cancelMigration("m-1", TENANT).getStatus()).isEqualTo(MigrationStatus.CANCELLED);
            verify(shardTypeStore).releaseRunningSlot(TENANT, "contacts", "m-1");
        }

        @Test
        @DisplayName("refuses to cancel a finished migration")
        void refusesTerminal() {
            when(migrationStore.getById("m-1", TENANT)).thenReturn(SchemaMigration.builder()
                    .id("m-1").tenantId(TENANT).shardTypeId("contacts").status(MigrationStatus.COMPLETED).build());

            assertThatThrownBy(() -> orchestrator.cancelMigration("m-1", TENANT))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage("Cannot cancel migration in status: COMPLETED");
            verify(migrationStore, never()).updateStatus(any(), any(), any(), any(), any());
        }
    }

    @Test
    @DisplayName("path lookups go through the resolver")
    void pathLookup() {
        when(migrationStore.listInVersionRange(TENANT, "contacts", 1, 2)).thenReturn(List.of(SchemaMigration.builder()
                .id("m-1").fromVersion(1).toVersion(2).status(MigrationStatus.COMPLETED).build()));

        assertThat(orchestrator.getMigrationPath(TENANT, "contacts", 1, 2))
                .extracting(SchemaMigration::getId).containsExactly("m-1");
    }
}
