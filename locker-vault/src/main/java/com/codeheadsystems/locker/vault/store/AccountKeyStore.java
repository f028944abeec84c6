package com.codeheadsystems.locker.vault.store;

import com.codeheadsystems.locker.crypto.model.WrappedVaultKey;
import java.util.Optional;

/**
 * Storage for each account's wrapped vault key.
 */
public interface AccountKeyStore {

  /**
   * Stores or replaces the wrapped vault key for an account.
   *
   * @param accountId the account
   * @param wrapped   the wrapped vault key
   */
  void store(String accountId, WrappedVaultKey wrapped);

  /**
   * Stores the wrapped vault key only if the account has none yet.
   *
   * @param accountId the account
   * @param wrapped   the wrapped vault key
   * @return true if stored, false if the account already had one
   */
  boolean storeIfAbsent(String accountId, WrappedVaultKey wrapped);

  /**
   * Loads the wrapped vault key for an account.
   *
   * @param accountId the account
   * @return the wrapped vault key, or empty if the account has none
   */
  Optional<WrappedVaultKey> load(String accountId);
}
