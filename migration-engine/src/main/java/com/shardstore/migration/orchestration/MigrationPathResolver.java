package com.shardstore.migration.orchestration;

import com.shardstore.migration.exception.NotFoundException;
import com.shardstore.migration.exception.ValidationException;
import com.shardstore.migration.model.MigrationStatus;
import com.shardstore.migration.model.SchemaMigration;
import com.shardstore.migration.store.MigrationRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chains single-version migrations into an upgrade path.
 * Cancelled hops stay in the chain: cancellation stops batch execution but the
 * schema bump it recorded still happened.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MigrationPathResolver {

    private final MigrationRecordStore migrationStore;

    /**
     * Ordered migrations leading from {@code fromVersion} to {@code toVersion}.
     *
     * @throws NotFoundException if any hop is missing
     */
    public List<SchemaMigration> resolve(String tenantId, String shardTypeId, int fromVersion, int toVersion) {
        if (fromVersion < 1 || toVersion < 1) {
            throw new ValidationException("Schema versions start at 1, got v" + fromVersion + " -> v" + toVersion);
        }
        if (fromVersion > toVersion) {
            throw new ValidationException("Cannot resolve a downgrade path from v" + fromVersion + " to v" + toVersion);
        }
        if (fromVersion == toVersion) {
            return List.of();
        }

        Map<Integer, SchemaMigration> byFromVersion = new HashMap<>();
        for (SchemaMigration migration : migrationStore.listInVersionRange(tenantId, shardTypeId, fromVersion, toVersion)) {
            if (migration.getToVersion() != migration.getFromVersion() + 1) {
                continue;
            }
            byFromVersion.merge(migration.getFromVersion(), migration, MigrationPathResolver::preferred);
        }

        List<SchemaMigration> path = new ArrayList<>(toVersion - fromVersion);
        for (int version = fromVersion; version < toVersion; version++) {
            SchemaMigration hop = byFromVersion.get(version);
            if (hop == null) {
                throw new NotFoundException(String.format(
                        "No migration from v%d to v%d for ShardType %s; path v%d -> v%d is broken",
                        version, version + 1, shardTypeId, fromVersion, toVersion));
            }
            path.add(hop);
        }

        log.debug("Resolved {} hop(s) for ShardType {} v{} -> v{}", path.size(), shardTypeId, fromVersion, toVersion);
        return path;
    }

    // Two rows for the same hop should not exist; if they do, a non-cancelled one wins
    private static SchemaMigration preferred(SchemaMigration existing, SchemaMigration candidate) {
        if (existing.getStatus() == MigrationStatus.CANCELLED && candidate.getStatus() != MigrationStatus.CANCELLED) {
            return candidate;
        }
        return existing;
    }
}
