package com.codeheadsystems.locker.vault.model;

import java.util.List;

/**
 * Outcome of migrating one account's records to the vault-key format.
 *
 * @param migratedCount       legacy records re-encoded and saved
 * @param skippedCount        records left untouched because they could not be migrated
 * @param alreadyCurrentCount records already in the current format
 * @param skippedIds          ids of the skipped records, for follow-up
 */
public record MigrationResult(int migratedCount,
                              int skippedCount,
                              int alreadyCurrentCount,
                              List<String> skippedIds) {

  public MigrationResult {
    skippedIds = List.copyOf(skippedIds);
  }

  public int total() {
    return migratedCount + skippedCount + alreadyCurrentCount;
  }
}
