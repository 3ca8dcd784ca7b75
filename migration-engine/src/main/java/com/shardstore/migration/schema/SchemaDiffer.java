package com.shardstore.migration.schema;

import com.shardstore.migration.config.MigrationProperties;
import lombok.RequiredArgsConstructor;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the structural diff between two schema definitions.
 * Output is sorted by field name so that field declaration order never affects it.
 */
@Component
@RequiredArgsConstructor
public class SchemaDiffer {

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private final MigrationProperties properties;

    public SchemaDiff diff(SchemaDefinition oldSchema, SchemaDefinition newSchema) {
        Objects.requireNonNull(oldSchema, "oldSchema");
        Objects.requireNonNull(newSchema, "newSchema");

        List<FieldChange> added = new ArrayList<>();
        List<FieldChange> removed = new ArrayList<>();
        List<FieldChange> modified = new ArrayList<>();

        Set<String> allFields = new TreeSet<>(oldSchema.fieldNames());
        allFields.addAll(newSchema.fieldNames());

        for (String name : allFields) {
            FieldDefinition before = oldSchema.field(name);
            FieldDefinition after = newSchema.field(name);

            if (before == null) {
                added.add(FieldChange.added(name, after));
            } else if (after == null) {
                removed.add(FieldChange.removed(name, before));
            } else if (isModified(before, after)) {
                modified.add(FieldChange.modified(name, before, after));
            }
        }

        return SchemaDiff.builder()
                .added(List.copyOf(added))
                .removed(List.copyOf(removed))
                .modified(List.copyOf(modified))
                .renamed(detectRenames(removed, added))
                .build();
    }

    private boolean isModified(FieldDefinition before, FieldDefinition after) {
        return before.getType() != after.getType()
                || before.isRequired() != after.isRequired()
                || !before.hasSameDefault(after)
                || !Objects.equals(before.getAllowedValues(), after.getAllowedValues());
    }

    /**
     * Pairs removed and added fields of the same type by name similarity.
     * Each field appears in at most one candidate; best matches win.
     */
    private List<RenameCandidate> detectRenames(List<FieldChange> removed, List<FieldChange> added) {
        double threshold = properties.getRename().getSimilarityThreshold();
        List<RenameCandidate> candidates = new ArrayList<>();

        for (FieldChange oldField : removed) {
            for (FieldChange newField : added) {
                if (oldField.getBefore().getType() != newField.getAfter().getType()) {
                    continue;
                }
                double similarity = similarity(oldField.getField(), newField.getField());
                if (similarity >= threshold) {
                    candidates.add(RenameCandidate.builder()
                            .from(oldField.getField())
                            .to(newField.getField())
                            .similarity(similarity)
                            .build());
                }
            }
        }

        candidates.sort(Comparator.comparingDouble(RenameCandidate::getSimilarity).reversed()
                .thenComparing(RenameCandidate::getFrom)
                .thenComparing(RenameCandidate::getTo));

        Set<String> usedFrom = new HashSet<>();
        Set<String> usedTo = new HashSet<>();
        List<RenameCandidate> accepted = new ArrayList<>();
        for (RenameCandidate candidate : candidates) {
            if (usedFrom.contains(candidate.getFrom()) || usedTo.contains(candidate.getTo())) {
                continue;
            }
            usedFrom.add(candidate.getFrom());
            usedTo.add(candidate.getTo());
            accepted.add(candidate);
        }
        accepted.sort(Comparator.comparing(RenameCandidate::getFrom));
        return List.copyOf(accepted);
    }

    static double similarity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 0.0;
        }
        return 1.0 - ((double) LEVENSHTEIN.apply(a, b) / longest);
    }

    // "first_name", "firstName" and "First-Name" compare equal
    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
