package com.codeheadsystems.locker.vault.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of decrypting many records at once.
 *
 * @param decrypted plaintext by record id, in record order
 * @param failedIds ids of records that could not be decrypted, in record order
 */
public record BatchDecryptResult(Map<String, String> decrypted, Set<String> failedIds) {

  public BatchDecryptResult {
    decrypted = Collections.unmodifiableMap(new LinkedHashMap<>(decrypted));
    failedIds = Collections.unmodifiableSet(new LinkedHashSet<>(failedIds));
  }
}
