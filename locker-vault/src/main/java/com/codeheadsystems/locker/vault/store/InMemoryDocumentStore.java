package com.codeheadsystems.locker.vault.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DocumentStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All documents are lost when the process exits. Suitable for development and testing only.
 */
public class InMemoryDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

  private final ConcurrentHashMap<String, String> documents = new ConcurrentHashMap<>();

  public InMemoryDocumentStore() {
    log.warn("Using InMemoryDocumentStore - vault records will NOT survive restarts.");
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(documents.get(key));
  }

  @Override
  public void put(String key, String value) {
    documents.put(key, value);
    log.debug("Stored document {} ({} chars)", key, value.length());
  }

  @Override
  public boolean putIfAbsent(String key, String value) {
    boolean written = documents.putIfAbsent(key, value) == null;
    log.debug("Conditional store of document {}: {}", key, written ? "written" : "already present");
    return written;
  }

  @Override
  public void delete(String key) {
    documents.remove(key);
  }

  /**
   * Number of documents held.
   *
   * @return the size
   */
  public int size() {
    return documents.size();
  }
}
