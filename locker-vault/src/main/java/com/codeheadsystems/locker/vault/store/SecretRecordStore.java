package com.codeheadsystems.locker.vault.store;

import com.codeheadsystems.locker.crypto.model.SecretRecord;
import java.util.List;
import java.util.Optional;

/**
 * Storage for an account's secret records.
 */
public interface SecretRecordStore {

  /**
   * Lists every record of an account, in insertion order.
   *
   * @param accountId the account
   * @return the records
   */
  List<SecretRecord> list(String accountId);

  /**
   * Loads one record.
   *
   * @param accountId the account
   * @param id        the record id
   * @return the record, or empty
   */
  Optional<SecretRecord> load(String accountId, String id);

  /**
   * Stores a new record or replaces the one with the same id.
   *
   * @param accountId the account
   * @param record    the record
   */
  void save(String accountId, SecretRecord record);

  /**
   * Removes a record, if present.
   *
   * @param accountId the account
   * @param id        the record id
   */
  void delete(String accountId, String id);
}
