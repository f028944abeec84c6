package com.codeheadsystems.locker.vault.manager;

import com.codeheadsystems.locker.crypto.common.ByteUtils;
import com.codeheadsystems.locker.crypto.config.VaultConfig;
import com.codeheadsystems.locker.crypto.exceptions.VaultErrorKind;
import com.codeheadsystems.locker.crypto.exceptions.VaultException;
import com.codeheadsystems.locker.crypto.kdf.KeyDerivation;
import com.codeheadsystems.locker.crypto.model.VaultKey;
import com.codeheadsystems.locker.crypto.model.WrappedVaultKey;
import com.codeheadsystems.locker.vault.store.AccountKeyStore;
import com.codeheadsystems.locker.vault.store.DocumentStoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the two-tier key model for the active session.
 * <p>
 * A master key is derived from the user's secret and the account salt; it only ever wraps or
 * unwraps the vault key and is wiped straight after. The vault key is random, generated once per
 * account, and is what actually encrypts stored secrets. Changing the master password therefore
 * only re-wraps the vault key.
 * <p>
 * <strong>Lifecycle:</strong>
 * <ol>
 *   <li>{@link #initializeForAccount} once per account: generate salt and vault key, wrap, persist.</li>
 *   <li>{@link #unlock} per session: re-derive the master key, unwrap, cache the vault key.</li>
 *   <li>{@link #lock} at session end: destroy the cached vault key.</li>
 * </ol>
 * Every unlock failure is reported as {@link VaultErrorKind#UNLOCK_FAILED} with the same message,
 * whether the password was wrong or the stored record is damaged.
 */
@Singleton
public class VaultKeyManager {

  static final String INCORRECT_PASSWORD = "Incorrect master password";

  private static final Logger log = LoggerFactory.getLogger(VaultKeyManager.class);

  private final VaultConfig config;
  private final AccountKeyStore accountKeyStore;
  private final Clock clock;
  private final Object sessionLock = new Object();

  // guarded by sessionLock
  private VaultKey vaultKey;
  private String accountId;

  @Inject
  public VaultKeyManager(final VaultConfig config, final AccountKeyStore accountKeyStore) {
    this(config, accountKeyStore, Clock.systemUTC());
  }

  public VaultKeyManager(final VaultConfig config, final AccountKeyStore accountKeyStore,
                         final Clock clock) {
    log.info("VaultKeyManager(kdfIterations={})", config.kdfIterations());
    this.config = config;
    this.accountKeyStore = accountKeyStore;
    this.clock = clock;
  }

  /**
   * Generates and persists the vault key for a new account, leaving the manager unlocked for it.
   *
   * @param accountId the account
   * @param secret    the master password, UTF-8
   * @return the new vault key, also cached for the session
   * @throws IllegalStateException if the account already has a vault key, including one written
   *                               concurrently by another caller; re-initializing would orphan
   *                               every secret encrypted under the existing one
   */
  public VaultKey initializeForAccount(final String accountId, final byte[] secret) {
    log.debug("initializeForAccount(accountId={})", accountId);
    if (accountKeyStore.load(accountId).isPresent()) {
      throw new IllegalStateException("Account already has a vault key: " + accountId);
    }
    byte[] salt = config.randomProvider().randomBytes(VaultConfig.SALT_LENGTH);
    byte[] raw = config.randomProvider().randomBytes(VaultKey.LENGTH);
    VaultKey key = VaultKey.of(raw);
    ByteUtils.wipe(raw);

    Instant now = clock.instant();
    WrappedVaultKey wrapped = wrap(secret, salt, key, config.keyDerivation(), now, now);
    if (!accountKeyStore.storeIfAbsent(accountId, wrapped)) {
      key.destroy();
      throw new IllegalStateException("Account already has a vault key: " + accountId);
    }
    install(accountId, key);
    log.info("Vault key initialized for account {}", accountId);
    return key;
  }

  /**
   * Loads the account's wrapped vault key and unlocks it.
   *
   * @param accountId the account
   * @param secret    the master password, UTF-8
   * @return the vault key, also cached for the session
   * @throws VaultException {@code UNLOCK_FAILED} on a wrong password, a damaged record, or an
   *                        account without a vault key
   */
  public VaultKey unlock(final String accountId, final byte[] secret) {
    log.debug("unlock(accountId={})", accountId);
    WrappedVaultKey wrapped = loadOrFail(accountId);
    VaultKey key = unwrapOrFail(secret, wrapped);
    install(accountId, key);
    return key;
  }

  /**
   * Unlocks a wrapped vault key supplied by the caller.
   *
   * @param secret  the master password, UTF-8
   * @param wrapped the stored record
   * @return the vault key, also cached for the session
   * @throws VaultException {@code UNLOCK_FAILED} on a wrong password or a damaged record
   */
  public VaultKey unlock(final byte[] secret, final WrappedVaultKey wrapped) {
    log.debug("unlock(wrapped)");
    VaultKey key = unwrapOrFail(secret, wrapped);
    install(null, key);
    return key;
  }

  /**
   * Re-wraps the account's vault key under a new master password. Stored secrets are untouched.
   * The salt is kept; the IV is fresh. The manager ends unlocked for the account.
   *
   * @param accountId the account
   * @param oldSecret the current master password, UTF-8
   * @param newSecret the new master password, UTF-8
   * @throws VaultException {@code UNLOCK_FAILED} if the current password is wrong
   */
  public void changeSecret(final String accountId, final byte[] oldSecret, final byte[] newSecret) {
    log.debug("changeSecret(accountId={})", accountId);
    WrappedVaultKey current = loadOrFail(accountId);
    VaultKey key = unwrapOrFail(oldSecret, current);
    WrappedVaultKey rewrapped = wrap(newSecret, current.salt(), key, config.keyDerivation(),
        current.createdAt(), clock.instant());
    accountKeyStore.store(accountId, rewrapped);
    install(accountId, key);
    log.info("Master password changed for account {}", accountId);
  }

  /**
   * True if the account has been initialized.
   *
   * @param accountId the account
   * @return true if a wrapped vault key is stored
   */
  public boolean hasVaultKey(final String accountId) {
    return accountKeyStore.load(accountId).isPresent();
  }

  /**
   * Destroys the cached vault key. Safe to call in any state. Operations that already copied the
   * key run to completion.
   */
  public void lock() {
    synchronized (sessionLock) {
      if (vaultKey != null) {
        vaultKey.destroy();
        log.info("Vault locked");
      }
      vaultKey = null;
      accountId = null;
    }
  }

  public boolean isUnlocked() {
    return state() == VaultState.UNLOCKED;
  }

  public VaultState state() {
    synchronized (sessionLock) {
      return vaultKey == null ? VaultState.LOCKED : VaultState.UNLOCKED;
    }
  }

  /**
   * The cached vault key.
   *
   * @return the vault key
   * @throws IllegalStateException if locked
   */
  public VaultKey currentKey() {
    synchronized (sessionLock) {
      if (vaultKey == null) {
        throw new IllegalStateException("Vault is locked");
      }
      return vaultKey;
    }
  }

  /**
   * The account the session was unlocked for, if it was unlocked by account id.
   *
   * @return the account id
   */
  public Optional<String> accountId() {
    synchronized (sessionLock) {
      return Optional.ofNullable(accountId);
    }
  }

  private WrappedVaultKey loadOrFail(String accountId) {
    Optional<WrappedVaultKey> wrapped;
    try {
      wrapped = accountKeyStore.load(accountId);
    } catch (DocumentStoreException e) {
      lock();
      log.info("Unlock failed for account {}: unreadable vault key record", accountId);
      throw new VaultException(VaultErrorKind.UNLOCK_FAILED, INCORRECT_PASSWORD);
    }
    if (wrapped.isEmpty()) {
      lock();
      log.info("Unlock failed for account {}", accountId);
      throw new VaultException(VaultErrorKind.UNLOCK_FAILED, INCORRECT_PASSWORD);
    }
    return wrapped.get();
  }

  private VaultKey unwrapOrFail(byte[] secret, WrappedVaultKey wrapped) {
    byte[] masterKey = null;
    byte[] raw = null;
    try {
      masterKey = config.keyDerivation().withIterations(wrapped.iterations())
          .derive(secret, wrapped.salt(), config.keyLength());
      raw = config.cipher().decrypt(wrapped.encryptedVaultKey(), masterKey, wrapped.vaultKeyIv());
      if (raw.length != VaultKey.LENGTH) {
        // padding happened to verify under the wrong key
        throw new VaultException(VaultErrorKind.DECRYPTION_FAILED, "Unwrapped key has wrong length");
      }
      return VaultKey.of(raw);
    } catch (VaultException | IllegalArgumentException e) {
      lock();
      log.info("Unlock failed");
      throw new VaultException(VaultErrorKind.UNLOCK_FAILED, INCORRECT_PASSWORD);
    } finally {
      ByteUtils.wipe(masterKey);
      ByteUtils.wipe(raw);
    }
  }

  private WrappedVaultKey wrap(byte[] secret, byte[] salt, VaultKey key, KeyDerivation kdf,
                               Instant createdAt, Instant updatedAt) {
    byte[] masterKey = kdf.derive(secret, salt, config.keyLength());
    byte[] raw = key.bytes();
    try {
      byte[] iv = config.randomProvider().randomBytes(config.ivLength());
      byte[] encrypted = config.cipher().encrypt(raw, masterKey, iv);
      return new WrappedVaultKey(salt, iv, encrypted, kdf.iterations(), createdAt, updatedAt);
    } finally {
      ByteUtils.wipe(masterKey);
      ByteUtils.wipe(raw);
    }
  }

  private void install(String accountId, VaultKey key) {
    synchronized (sessionLock) {
      if (vaultKey != null && vaultKey != key) {
        vaultKey.destroy();
      }
      vaultKey = key;
      this.accountId = accountId;
    }
  }
}
