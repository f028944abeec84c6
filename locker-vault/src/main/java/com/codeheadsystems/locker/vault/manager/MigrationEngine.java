package com.codeheadsystems.locker.vault.manager;

import com.codeheadsystems.locker.crypto.codec.BlobFormat;
import com.codeheadsystems.locker.crypto.codec.SecretCodec;
import com.codeheadsystems.locker.crypto.config.VaultConfig;
import com.codeheadsystems.locker.crypto.exceptions.VaultException;
import com.codeheadsystems.locker.crypto.model.SecretRecord;
import com.codeheadsystems.locker.crypto.model.VaultKey;
import com.codeheadsystems.locker.vault.model.MigrationResult;
import com.codeheadsystems.locker.vault.store.SecretRecordStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upgrades an account's legacy-format secrets to the vault-key format.
 * <p>
 * Best effort: each record is decoded, re-encoded and saved on its own, and a record that fails
 * is left exactly as it was and counted as skipped. Records already in the current format are
 * not rewritten, so running the migration again is a no-op.
 * <p>
 * Untagged blobs of legacy length may also be long current-format blobs. Both readings are
 * attempted: legacy only is migrated, current only is counted as already current, and a blob
 * that reads both ways is skipped for audit.
 * <p>
 * The vault must already be unlocked: the master key is derived once at unlock and the cached
 * vault key is reused for every record.
 */
@Singleton
public class MigrationEngine {

  private static final Logger log = LoggerFactory.getLogger(MigrationEngine.class);

  private final SecretCodec codec;
  private final VaultKeyManager vaultKeyManager;
  private final SecretRecordStore secretRecordStore;
  private final Clock clock;

  @Inject
  public MigrationEngine(final VaultConfig config,
                         final VaultKeyManager vaultKeyManager,
                         final SecretRecordStore secretRecordStore) {
    this(new SecretCodec(config), vaultKeyManager, secretRecordStore, Clock.systemUTC());
  }

  public MigrationEngine(final SecretCodec codec,
                         final VaultKeyManager vaultKeyManager,
                         final SecretRecordStore secretRecordStore,
                         final Clock clock) {
    log.info("MigrationEngine()");
    this.codec = codec;
    this.vaultKeyManager = vaultKeyManager;
    this.secretRecordStore = secretRecordStore;
    this.clock = clock;
  }

  /**
   * Migrates every stored record of the account the vault is unlocked for.
   *
   * @param accountId the account
   * @param secret    the master password, needed to read legacy blobs
   * @return the counts
   * @throws IllegalStateException if the vault is locked or unlocked for another account
   */
  public MigrationResult migrateAccount(final String accountId, final byte[] secret) {
    VaultKey vaultKey = sessionKeyFor(accountId);
    return migrateAccount(accountId, vaultKey, secret, secretRecordStore.list(accountId));
  }

  /**
   * Migrates the given records with an explicitly supplied vault key, saving each migrated
   * record to the store.
   *
   * @param accountId the account the records belong to
   * @param vaultKey  the unlocked vault key
   * @param secret    the master password, needed to read legacy blobs
   * @param records   the records to examine
   * @return the counts
   */
  public MigrationResult migrateAccount(final String accountId,
                                        final VaultKey vaultKey,
                                        final byte[] secret,
                                        final List<SecretRecord> records) {
    log.debug("migrateAccount(accountId={}, records={})", accountId, records.size());
    int migrated = 0;
    int alreadyCurrent = 0;
    List<String> skipped = new ArrayList<>();
    for (SecretRecord record : records) {
      BlobFormat format = codec.detectFormat(record.encryptedPassword());
      switch (format) {
        case CURRENT -> alreadyCurrent++;
        case LEGACY -> {
          switch (migrateRecord(accountId, vaultKey, secret, record)) {
            case MIGRATED -> migrated++;
            case ALREADY_CURRENT -> alreadyCurrent++;
            default -> skipped.add(record.id());
          }
        }
        default -> {
          log.warn("Skipping record {}: unrecognized blob format", record.id());
          skipped.add(record.id());
        }
      }
    }
    MigrationResult result = new MigrationResult(migrated, skipped.size(), alreadyCurrent, skipped);
    if (migrated > 0 || !skipped.isEmpty()) {
      log.info("Migrated {} of {} records for account {} ({} skipped)",
          migrated, records.size(), accountId, skipped.size());
    }
    return result;
  }

  private Outcome migrateRecord(String accountId, VaultKey vaultKey, byte[] secret,
                                SecretRecord record) {
    String blob = record.encryptedPassword();
    Optional<String> legacy = readLegacy(blob, secret);
    boolean current = codec.isUntagged(blob) && readsAsCurrent(blob, vaultKey);
    if (legacy.isPresent() && current) {
      log.warn("Skipping record {}: untagged blob reads as both legacy and current", record.id());
      return Outcome.SKIPPED;
    }
    if (current) {
      log.debug("Record {} is an untagged current blob", record.id());
      return Outcome.ALREADY_CURRENT;
    }
    if (legacy.isEmpty()) {
      return Outcome.SKIPPED;
    }
    SecretRecord updated = record.withEncryptedPassword(
        codec.encodeCurrent(legacy.get(), vaultKey), clock.instant());
    try {
      secretRecordStore.save(accountId, updated);
    } catch (RuntimeException e) {
      log.warn("Skipping record {}: save failed", record.id(), e);
      return Outcome.SKIPPED;
    }
    return Outcome.MIGRATED;
  }

  private Optional<String> readLegacy(String blob, byte[] secret) {
    try {
      return Optional.of(codec.decodeLegacy(blob, secret));
    } catch (VaultException e) {
      log.warn("Legacy decode failed ({})", e.kind());
      return Optional.empty();
    }
  }

  private boolean readsAsCurrent(String blob, VaultKey vaultKey) {
    try {
      codec.decodeCurrent(blob, vaultKey);
      return true;
    } catch (VaultException e) {
      return false;
    }
  }

  private VaultKey sessionKeyFor(String accountId) {
    if (!vaultKeyManager.isUnlocked()) {
      throw new IllegalStateException("Vault must be unlocked before migrating " + accountId);
    }
    Optional<String> unlockedFor = vaultKeyManager.accountId();
    if (unlockedFor.isPresent() && !unlockedFor.get().equals(accountId)) {
      throw new IllegalStateException("Vault is unlocked for a different account");
    }
    return vaultKeyManager.currentKey();
  }

  private enum Outcome {
    MIGRATED,
    ALREADY_CURRENT,
    SKIPPED
  }
}
