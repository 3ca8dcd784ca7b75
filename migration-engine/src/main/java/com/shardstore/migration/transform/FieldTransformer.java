package com.shardstore.migration.transform;

import com.shardstore.migration.exception.TransformException;
import com.shardstore.migration.schema.FieldChange;
import com.shardstore.migration.schema.FieldDefinition;
import com.shardstore.migration.schema.SchemaDiff;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the migrated payload of a single record.
 * Pure: the input map is never modified. Used by both the batch executor and
 * the on-read upgrade path so both produce identical results.
 */
@Component
public class FieldTransformer {

    public Map<String, Object> transform(
            Map<String, Object> structuredData,
            Map<String, String> fieldMappings,
            Map<String, Object> defaultValues,
            SchemaDiff diff) {

        return transform(structuredData, TransformPlan.builder()
                .fieldMappings(fieldMappings == null ? Map.of() : fieldMappings)
                .defaultValues(defaultValues == null ? Map.of() : defaultValues)
                .diff(diff == null ? SchemaDiff.empty() : diff)
                .build());
    }

    public Map<String, Object> transform(Map<String, Object> structuredData, TransformPlan plan) {
        Map<String, Object> result = structuredData == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(structuredData);

        applyMappings(result, plan.getFieldMappings());
        applyTypeTransformations(result, plan.getTypeTransformations());
        applyDefaults(result, plan);

        for (FieldChange removed : plan.getDiff().getRemoved()) {
            result.remove(removed.getField());
        }

        verifyRequiredFields(result, plan.getDiff());
        return result;
    }

    // All sources are lifted before any target is written, so chained mappings (a->b, b->c) do not cascade
    private void applyMappings(Map<String, Object> data, Map<String, String> fieldMappings) {
        Map<String, Object> moved = new LinkedHashMap<>();
        for (Map.Entry<String, String> mapping : fieldMappings.entrySet()) {
            if (data.containsKey(mapping.getKey())) {
                moved.put(mapping.getValue(), data.remove(mapping.getKey()));
            }
        }
        data.putAll(moved);
    }

    private void applyTypeTransformations(
            Map<String, Object> data, Map<String, BuiltInTransformation> transformations) {

        for (Map.Entry<String, BuiltInTransformation> entry : transformations.entrySet()) {
            String field = entry.getKey();
            Object value = data.get(field);
            if (value == null) {
                continue;
            }
            try {
                data.put(field, entry.getValue().apply(value));
            } catch (RuntimeException e) {
                throw new TransformException(
                        "Field '" + field + "' could not be converted with " + entry.getValue()
                                + ": " + e.getMessage(), e);
            }
        }
    }

    private void applyDefaults(Map<String, Object> data, TransformPlan plan) {
        List<FieldChange> candidates = new ArrayList<>(plan.getDiff().getAdded());
        plan.getDiff().getModified().stream()
                .filter(FieldChange::isMadeRequired)
                .forEach(candidates::add);

        for (FieldChange change : candidates) {
            String field = change.getField();
            if (isSet(data, field)) {
                continue;
            }
            Object fill = plan.getDefaultValues().containsKey(field)
                    ? plan.getDefaultValues().get(field)
                    : change.getAfter().getDefaultValue();
            if (fill != null) {
                data.put(field, fill);
            }
        }
    }

    private void verifyRequiredFields(Map<String, Object> data, SchemaDiff diff) {
        List<String> missing = new ArrayList<>();
        for (FieldChange change : diff.getAdded()) {
            if (change.getAfter().isRequired() && !isSet(data, change.getField())) {
                missing.add(change.getField());
            }
        }
        for (FieldChange change : diff.getModified()) {
            FieldDefinition after = change.getAfter();
            if (after.isRequired() && !isSet(data, change.getField())) {
                missing.add(change.getField());
            }
        }
        if (!missing.isEmpty()) {
            throw new TransformException("Required field(s) still unset after defaulting: " + missing);
        }
    }

    private static boolean isSet(Map<String, Object> data, String field) {
        return data.get(field) != null;
    }
}
