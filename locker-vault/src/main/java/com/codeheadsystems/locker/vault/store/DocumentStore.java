package com.codeheadsystems.locker.vault.store;

import java.util.Optional;

/**
 * Key/value document storage the vault persists its records into.
 * <p>
 * Values are JSON text. Implementations must be thread-safe. Production implementations
 * typically back this with a cloud document database.
 */
public interface DocumentStore {

  /**
   * Reads a document.
   *
   * @param key the document key
   * @return the document, or empty if absent
   */
  Optional<String> get(String key);

  /**
   * Writes or replaces a document.
   *
   * @param key   the document key
   * @param value the JSON document
   */
  void put(String key, String value);

  /**
   * Writes a document only if none exists under the key, atomically.
   *
   * @param key   the document key
   * @param value the JSON document
   * @return true if written, false if a document was already present
   */
  boolean putIfAbsent(String key, String value);

  /**
   * Removes a document, if present.
   *
   * @param key the document key
   */
  void delete(String key);
}
