package com.shardstore.migration.schema;

import com.shardstore.migration.config.MigrationProperties;
import com.shardstore.migration.transform.BuiltInTransformation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Labels a schema diff compatible or breaking.
 * Every rule is evaluated; all breaking reasons are collected.
 */
@Component
@RequiredArgsConstructor
public class CompatibilityClassifier {

    private final MigrationProperties properties;

    public CompatibilityResult classify(SchemaDiff diff) {
        List<BreakingChange> breaking = new ArrayList<>();

        for (FieldChange change : diff.getAdded()) {
            FieldDefinition after = change.getAfter();
            if (after.isRequired() && !after.hasDefaultValue()) {
                breaking.add(BreakingChange.builder()
                        .field(change.getField())
                        .kind(BreakingChangeKind.REQUIRED_FIELD_ADDED)
                        .message("Field '" + change.getField() + "' added as required without a default value")
                        .resolution("Provide a default value for existing records")
                        .build());
            }
        }

        for (FieldChange change : diff.getRemoved()) {
            breaking.add(BreakingChange.builder()
                    .field(change.getField())
                    .kind(BreakingChangeKind.FIELD_REMOVED)
                    .message("Field '" + change.getField() + "' removed")
                    .resolution("Map the field to a new name or acknowledge the removal explicitly")
                    .build());
        }

        for (FieldChange change : diff.getModified()) {
            classifyModification(change, breaking);
        }

        for (RenameCandidate rename : diff.getRenamed()) {
            breaking.add(BreakingChange.builder()
                    .field(rename.getFrom())
                    .relatedField(rename.getTo())
                    .kind(BreakingChangeKind.POSSIBLE_RENAME)
                    .message("Field '" + rename.getFrom() + "' looks renamed to '" + rename.getTo() + "'")
                    .resolution("Confirm with a field mapping '" + rename.getFrom() + "' -> '"
                            + rename.getTo() + "' or acknowledge the removal")
                    .build());
        }

        return CompatibilityResult.builder()
                .compatible(breaking.isEmpty())
                .breakingChanges(List.copyOf(breaking))
                .recommendations(recommend(diff, breaking))
                .build();
    }

    private void classifyModification(FieldChange change, List<BreakingChange> breaking) {
        FieldDefinition before = change.getBefore();
        FieldDefinition after = change.getAfter();
        String field = change.getField();

        if (change.isTypeChanged() && !isAllowedWidening(before.getType(), after.getType())) {
            String resolution = BuiltInTransformation.suggest(before.getType(), after.getType())
                    .map(transformation -> "Use transformation: " + transformation.name())
                    .orElse("Provide a type transformation for existing values");
            breaking.add(BreakingChange.builder()
                    .field(field)
                    .kind(BreakingChangeKind.TYPE_CHANGED)
                    .message("Field '" + field + "' type changed from '" + before.getType().getValue()
                            + "' to '" + after.getType().getValue() + "'")
                    .resolution(resolution)
                    .build());
        }

        if (change.isMadeRequired() && !after.hasDefaultValue()) {
            breaking.add(BreakingChange.builder()
                    .field(field)
                    .kind(BreakingChangeKind.MADE_REQUIRED)
                    .message("Field '" + field + "' made required without a default value")
                    .resolution("Provide a default value for existing records")
                    .build());
        }

        List<String> droppedValues = change.getRemovedAllowedValues();
        if (!droppedValues.isEmpty()) {
            breaking.add(BreakingChange.builder()
                    .field(field)
                    .kind(BreakingChangeKind.ALLOWED_VALUE_REMOVED)
                    .message("Field '" + field + "' no longer allows " + droppedValues)
                    .resolution("Review records holding removed values, then acknowledge the narrowing explicitly")
                    .build());
        }
    }

    private boolean isAllowedWidening(FieldType from, FieldType to) {
        return properties.getCompatibility().isAllowWidening() && from.widensTo(to);
    }

    private List<String> recommend(SchemaDiff diff, List<BreakingChange> breaking) {
        List<String> recommendations = new ArrayList<>();
        if (!breaking.isEmpty()) {
            recommendations.add("Consider a phased rollout with lazy migration");
            recommendations.add("Back up existing data before migration");
        }
        if (!diff.getRemoved().isEmpty()) {
            recommendations.add("Removed fields will lose data - export first if needed");
        }
        return List.copyOf(recommendations);
    }
}
